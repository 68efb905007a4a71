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

/**
 * Why a generation request was answered with degraded content.
 */
public enum DegradationReason {

    RATE_LIMITED("rate_limited", "Request rate limit reached, please retry shortly"),

    BUDGET_EXCEEDED("budget_exceeded", "AI usage budget for this billing period is exhausted"),

    CIRCUITS_OPEN("circuits_open", "All AI providers are temporarily unavailable"),

    PROVIDERS_FAILED("providers_failed", "AI providers failed to answer in time"),

    NO_PROVIDERS("no_providers", "No AI provider is configured for this request");

    private final String code;
    private final String message;

    DegradationReason(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    /**
     * Human-readable text for a "service degraded" notice.
     */
    public String getMessage() {
        return message;
    }
}
