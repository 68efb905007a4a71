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

public class RateLimitExceededException extends AiCallException {

    private static final long serialVersionUID = 1L;

    private final String subjectId;
    private final String operationClass;
    private final transient Duration retryAfter;

    public RateLimitExceededException(String subjectId, String operationClass, Duration retryAfter) {
        super("Rate limit exceeded for operation class " + operationClass);
        this.subjectId = subjectId;
        this.operationClass = operationClass;
        this.retryAfter = retryAfter;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
