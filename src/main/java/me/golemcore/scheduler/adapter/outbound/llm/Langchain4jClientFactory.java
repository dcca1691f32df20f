package me.golemcore.scheduler.adapter.outbound.llm;

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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.port.outbound.ModelClient;
import me.golemcore.scheduler.port.outbound.ModelClientFactoryPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds langchain4j chat models. Anthropic gets its native client; every
 * other provider is treated as OpenAI-compatible.
 *
 * <p>
 * SDK-level retries are disabled: the request manager owns retry and backoff.
 */
@Component
@Slf4j
public class Langchain4jClientFactory implements ModelClientFactoryPort {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int ANTHROPIC_MAX_TOKENS = 4096;

    @Override
    public boolean supports(String providerId) {
        return providerId != null && !providerId.isBlank() && !NoOpClientFactory.PROVIDER_NONE.equals(providerId);
    }

    @Override
    public ModelClient create(IsolationScope scope, ModelConfig config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + config.getProviderId()
                    + ". Add scheduler.providers." + config.getProviderId() + ".api-key");
        }
        ChatModel chatModel = PROVIDER_ANTHROPIC.equals(config.getProviderId())
                ? createAnthropicModel(config)
                : createOpenAiModel(config);
        log.debug("[Clients] Built {} model {} for {}", config.getProviderId(), config.getModelName(),
                scope.scopeKey());
        return new Langchain4jModelClient(config, chatModel);
    }

    private ChatModel createAnthropicModel(ModelConfig config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .maxRetries(0)
                .maxTokens(ANTHROPIC_MAX_TOKENS)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(ModelConfig config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
