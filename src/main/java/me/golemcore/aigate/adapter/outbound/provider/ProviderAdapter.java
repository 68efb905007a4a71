package me.golemcore.aigate.adapter.outbound.provider;

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

import me.golemcore.aigate.port.outbound.ProviderPort;

/**
 * Interface for provider transport adapters.
 *
 * <p>
 * Any Spring bean implementing this interface is registered by
 * {@link ProviderAdapterRegistry} under its provider id and takes precedence
 * over an endpoint configured for the same id.
 *
 * @see ProviderAdapterRegistry
 */
public interface ProviderAdapter extends ProviderPort {

    /**
     * Prepares clients before the first call. Called once at registration.
     */
    default void initialize() {
        // Default no-op
    }
}
