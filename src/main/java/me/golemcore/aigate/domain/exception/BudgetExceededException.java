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

/**
 * Tenant exhausted its cost allowance. Not retryable until period rollover
 * or a manual override.
 */
public class BudgetExceededException extends AiCallException {

    private static final long serialVersionUID = 1L;

    private final String tenantId;

    public BudgetExceededException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
