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

import me.golemcore.aigate.domain.exception.RateLimitExceededException;
import me.golemcore.aigate.domain.model.BucketState;
import me.golemcore.aigate.domain.model.RateLimitResult;

/**
 * Admission control per subject (user or API key) and operation class.
 *
 * <p>
 * Each operation class maps to a tier: either a fixed window ("20 per
 * minute") or a concurrency cap ("3 in flight"). Admission is independent of
 * provider health.
 *
 * @since 1.0
 * @see FixedWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Counts the request and reports whether it is admitted. For concurrency
     * tiers an admitted result holds a slot that must be released with
     * {@link RateLimitResult#release()}.
     *
     * @throws IllegalArgumentException
     *             if the operation class has no configured tier
     */
    RateLimitResult checkAndIncrement(String subjectId, String operationClass);

    /**
     * Same as {@link #checkAndIncrement} but throws on denial.
     */
    default RateLimitResult enforce(String subjectId, String operationClass) {
        RateLimitResult result = checkAndIncrement(subjectId, operationClass);
        if (!result.isAllowed()) {
            throw new RateLimitExceededException(subjectId, operationClass, result.getWaitTime());
        }
        return result;
    }

    /**
     * Get current window state, or {@code null} if the pair has no bucket.
     */
    BucketState getBucketState(String subjectId, String operationClass);
}
