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

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Static description of one upstream provider/model pair.
 *
 * <p>
 * Prices are per 1000 tokens. The router walks descriptors in
 * {@link #PRIORITY_ORDER}; the governor uses the prices for estimates.
 */
@Value
@Builder
public class ProviderDescriptor {

    public static final Comparator<ProviderDescriptor> PRIORITY_ORDER = Comparator
            .comparingInt(ProviderDescriptor::getPriorityRank)
            .thenComparing(ProviderDescriptor::getProviderId)
            .thenComparing(ProviderDescriptor::getModelId);

    String providerId;
    String modelId;
    int priorityRank;
    BigDecimal costPerThousandInput;
    BigDecimal costPerThousandOutput;
    String qualityTier;

    public String getKey() {
        return providerId + "/" + modelId;
    }
}
