package me.golemcore.aigate.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.aigate.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps in-flight calls of one subject for tiers such as streaming, where the
 * cost is the open connection rather than the request rate.
 */
public class ConcurrencyLimiter {

    private final int maxConcurrent;
    private final Semaphore slots;

    public ConcurrencyLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.slots = new Semaphore(maxConcurrent);
    }

    /**
     * Never blocks. An admitted result holds a slot until released.
     */
    public RateLimitResult tryAcquire() {
        if (!slots.tryAcquire()) {
            return RateLimitResult.denied(maxConcurrent, Duration.ZERO, "Too many concurrent requests");
        }
        AtomicBoolean released = new AtomicBoolean();
        Runnable permit = () -> {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        };
        return RateLimitResult.allowed(slots.availablePermits(), maxConcurrent, permit);
    }

    public int getActiveCount() {
        return maxConcurrent - slots.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}
