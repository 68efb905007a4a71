package me.golemcore.aigate.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long remaining;
    private long limit;
    private Duration waitTime;
    private String reason;

    // Held concurrency slot, null for windowed tiers
    private Runnable permit;

    public static RateLimitResult allowed(long remaining, long limit) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .limit(limit)
                .build();
    }

    public static RateLimitResult allowed(long remaining, long limit, Runnable permit) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .limit(limit)
                .permit(permit)
                .build();
    }

    public static RateLimitResult denied(long limit, Duration waitTime, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remaining(0)
                .limit(limit)
                .waitTime(waitTime)
                .reason(reason)
                .build();
    }

    /**
     * Releases the concurrency slot if this admission holds one. Safe to call
     * more than once.
     */
    public void release() {
        Runnable held = permit;
        permit = null;
        if (held != null) {
            held.run();
        }
    }
}
