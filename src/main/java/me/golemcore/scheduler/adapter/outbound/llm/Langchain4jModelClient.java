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

import dev.langchain4j.model.chat.ChatModel;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.port.outbound.ModelClient;

/**
 * {@link ModelClient} backed by a langchain4j {@link ChatModel}.
 */
public class Langchain4jModelClient implements ModelClient {

    private final ModelConfig config;
    private final ChatModel chatModel;
    private volatile boolean closed;

    public Langchain4jModelClient(ModelConfig config, ChatModel chatModel) {
        this.config = config;
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return config.getProviderId();
    }

    @Override
    public ModelConfig getConfig() {
        return config;
    }

    @Override
    public boolean isAvailable() {
        return !closed && chatModel != null;
    }

    @Override
    public <T> T unwrap(Class<T> type) {
        if (type.isInstance(chatModel)) {
            return type.cast(chatModel);
        }
        throw new IllegalStateException("Client for " + config.getProviderId() + " does not wrap " + type.getName());
    }

    @Override
    public void close() {
        closed = true;
    }
}
