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

import me.golemcore.aigate.domain.model.BucketState;
import me.golemcore.aigate.domain.model.RateLimitResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Thread-safe fixed-window request counter.
 *
 * <p>
 * The window starts with the first request and resets once {@code window}
 * has elapsed since its start. Every request is counted, admitted or not, so
 * a client retrying in a tight loop keeps its window used instead of
 * resetting it.
 *
 * <p>
 * Known tradeoff: a client can get up to {@code 2 * limit} requests through
 * around a window boundary (end of one window plus start of the next). This
 * is accepted in exchange for O(1) state; a sliding window or token bucket
 * would close the gap.
 *
 * @since 1.0
 */
public class FixedWindowCounter {

    private final long limit;
    private final Duration window;
    private Instant windowStart;
    private long count;

    public FixedWindowCounter(long limit, Duration window) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        this.limit = limit;
        this.window = window;
    }

    /**
     * Count one request at {@code now}.
     */
    public synchronized RateLimitResult checkAndIncrement(Instant now) {
        rollIfElapsed(now);
        count++;
        if (count > limit) {
            Duration wait = Duration.between(now, windowStart.plus(window));
            return RateLimitResult.denied(limit, wait.isNegative() ? Duration.ZERO : wait, "Rate limit exceeded");
        }
        return RateLimitResult.allowed(limit - count, limit);
    }

    /**
     * Whether the current window is over, making this counter safe to drop.
     */
    public synchronized boolean isExpired(Instant now) {
        return windowStart == null || !now.isBefore(windowStart.plus(window));
    }

    public synchronized BucketState getState(String key) {
        return BucketState.builder()
                .key(key)
                .count(count)
                .limit(limit)
                .windowStart(windowStart)
                .window(window)
                .build();
    }

    private void rollIfElapsed(Instant now) {
        if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
            windowStart = now;
            count = 0;
        }
    }
}
