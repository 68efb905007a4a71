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
import java.util.List;
import java.util.Map;

/**
 * One logical AI request as handed over by the task layer.
 */
@Data
@Builder
public class GenerationRequest {

    private String subjectId;
    private String tenantId;
    private String taskType;
    private String prompt;

    @Builder.Default
    private Map<String, String> context = Map.of();

    @Builder.Default
    private List<String> preferredProviders = List.of();

    // Explicit rate-limit tier, resolved from the task type when absent
    private String operationClass;

    // Per-call upstream timeout, configured default when absent
    private Duration timeout;
}
