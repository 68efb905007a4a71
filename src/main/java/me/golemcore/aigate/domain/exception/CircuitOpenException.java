package me.golemcore.aigate.domain.exception;

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

import java.time.Duration;

/**
 * Provider/model is currently refused by its circuit breaker.
 */
public class CircuitOpenException extends AiCallException {

    private static final long serialVersionUID = 1L;

    private final String providerId;
    private final String modelId;
    private final transient Duration retryAfter;

    public CircuitOpenException(String providerId, String modelId, Duration retryAfter) {
        super("Circuit open for " + providerId + "/" + modelId);
        this.providerId = providerId;
        this.modelId = modelId;
        this.retryAfter = retryAfter;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
