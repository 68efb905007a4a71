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
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached generation output. Never mutated after insertion.
 */
@Value
@Builder
public class CacheEntry {

    String fingerprint;
    String payload;
    Instant createdAt;
    Duration ttl;
    String providerUsed;
    String modelUsed;

    // Set for cached fallback answers only
    DegradationReason reason;

    @Builder.Default
    double confidence = 1.0;

    public boolean isFallback() {
        return reason != null;
    }

    public Instant getExpiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(getExpiresAt());
    }
}
