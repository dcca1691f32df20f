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

import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.port.outbound.ModelClient;
import me.golemcore.scheduler.port.outbound.ModelClientFactoryPort;
import org.springframework.stereotype.Component;

/**
 * Factory for provider {@code none}. Its handles are never available, so
 * scopes configured without a provider fail through the normal retry path.
 */
@Component
public class NoOpClientFactory implements ModelClientFactoryPort {

    public static final String PROVIDER_NONE = "none";

    @Override
    public boolean supports(String providerId) {
        return PROVIDER_NONE.equals(providerId);
    }

    @Override
    public ModelClient create(IsolationScope scope, ModelConfig config) {
        return new NoOpModelClient(config);
    }

    static final class NoOpModelClient implements ModelClient {

        private final ModelConfig config;

        NoOpModelClient(ModelConfig config) {
            this.config = config;
        }

        @Override
        public String getProviderId() {
            return PROVIDER_NONE;
        }

        @Override
        public ModelConfig getConfig() {
            return config;
        }

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public <T> T unwrap(Class<T> type) {
            throw new IllegalStateException("No-op client wraps nothing");
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
