package me.golemcore.aigate.port.outbound;

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

import me.golemcore.aigate.domain.model.ProviderResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Port for invoking an upstream language-model provider. The router depends
 * only on this interface and on static provider descriptors.
 */
public interface ProviderPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Sends one prompt to a model of this provider. Failures complete the
     * future exceptionally, preferably with a
     * {@link me.golemcore.aigate.domain.exception.ProviderException}.
     */
    CompletableFuture<ProviderResult> invoke(String modelId, String prompt, Duration timeout);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
