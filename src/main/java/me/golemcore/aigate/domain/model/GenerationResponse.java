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

import java.math.BigDecimal;

/**
 * Answer of the router. Always present, even when every provider refused or
 * failed; {@link #isDegraded()} plus {@link #getReason()} tell the
 * presentation layer whether to show a degraded-service notice.
 */
@Data
@Builder
public class GenerationResponse {

    private String text;
    private ResponseSource source;
    private boolean degraded;
    private DegradationReason reason;
    private String providerUsed;
    private String modelUsed;
    private int tokensUsed;

    @Builder.Default
    private BigDecimal cost = BigDecimal.ZERO;

    @Builder.Default
    private double confidence = 1.0;

    private String fingerprint;

    public String getReasonMessage() {
        return reason != null ? reason.getMessage() : null;
    }
}
