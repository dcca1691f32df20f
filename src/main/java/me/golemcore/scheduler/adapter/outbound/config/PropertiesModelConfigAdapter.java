package me.golemcore.scheduler.adapter.outbound.config;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.infrastructure.config.ModelConfigService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ModelConfigPort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Resolves a scope's model from {@code scheduler.models.*} properties.
 *
 * <p>
 * Lookup order: {@code overrides[tenant:agent]}, {@code overrides[tenant]},
 * {@code default-model}. Provider, upstream model name and pricing come from
 * the model catalog; credentials and endpoint from
 * {@code scheduler.providers.<provider>.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesModelConfigAdapter implements ModelConfigPort {

    private static final long DEFAULT_TIMEOUT_MS = 60_000L;

    private final SchedulerProperties properties;
    private final ModelConfigService modelConfigService;

    @Override
    public ModelConfig resolveModelConfig(IsolationScope scope) {
        String modelId = resolveModelId(scope);
        String providerId = modelConfigService.getProvider(modelId);
        ModelConfigService.ModelSettings settings = modelConfigService.getModelSettings(modelId);
        SchedulerProperties.ProviderProperties provider = properties.getProviders().get(providerId);

        ModelConfig.ModelConfigBuilder builder = ModelConfig.builder()
                .providerId(providerId)
                .modelName(modelConfigService.getModelName(modelId))
                .priceInPerMillion(orZero(settings.getPriceInPerMillion()))
                .priceOutPerMillion(orZero(settings.getPriceOutPerMillion()))
                .timeoutMs(DEFAULT_TIMEOUT_MS);
        if (provider != null) {
            builder.apiKey(provider.getApiKey()).baseUrl(provider.getBaseUrl());
            if (provider.getRequestTimeoutMs() != null) {
                builder.timeoutMs(provider.getRequestTimeoutMs());
            }
        } else {
            log.debug("[ModelConfig] No provider settings for '{}' ({})", providerId, scope.scopeKey());
        }
        return builder.build();
    }

    private String resolveModelId(IsolationScope scope) {
        SchedulerProperties.ModelsProperties models = properties.getModels();
        String byAgent = models.getOverrides().get(scope.scopeKey());
        if (byAgent != null && !byAgent.isBlank()) {
            return byAgent;
        }
        String byTenant = models.getOverrides().get(scope.tenantId());
        if (byTenant != null && !byTenant.isBlank()) {
            return byTenant;
        }
        return models.getDefaultModel();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
