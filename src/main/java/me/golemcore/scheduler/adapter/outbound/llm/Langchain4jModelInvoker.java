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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.ProviderTerminalException;
import me.golemcore.scheduler.domain.exception.ProviderTransientException;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ModelCallResult;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.domain.model.ModelPayload;
import me.golemcore.scheduler.domain.service.ProviderErrorClassifier;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ModelClient;
import me.golemcore.scheduler.port.outbound.ModelInvokerPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking langchain4j chat calls on a bounded executor.
 *
 * <p>
 * Cancelling the request's token interrupts the running call and completes
 * the returned future with a {@link CancellationException}. Cost is computed
 * from the client's pricing and the provider-reported token usage.
 */
@Component
@Slf4j
public class Langchain4jModelInvoker implements ModelInvokerPort {

    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final ExecutorService executor;

    @Autowired
    public Langchain4jModelInvoker(SchedulerProperties properties) {
        this(properties.getWorkers().getPoolSize());
    }

    Langchain4jModelInvoker(int threads) {
        AtomicInteger index = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "model-call-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void destroy() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public CompletableFuture<ModelCallResult> invoke(ModelClient client, ModelPayload payload, Instant deadline,
            CancellationToken token) {
        CompletableFuture<ModelCallResult> result = new CompletableFuture<>();
        if (token.isCancelled()) {
            result.completeExceptionally(new CancellationException("Cancelled before dispatch"));
            return result;
        }

        ChatModel chatModel;
        try {
            chatModel = client.unwrap(ChatModel.class);
        } catch (IllegalStateException e) {
            result.completeExceptionally(new ProviderTerminalException(ProviderErrorClassifier.UNSUPPORTED_FEATURE,
                    e.getMessage(), e));
            return result;
        }
        ChatRequest request = toChatRequest(payload);
        ModelConfig config = client.getConfig();

        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<?> task;
        try {
            task = executor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return;
                }
                try {
                    ChatResponse response = chatModel.chat(request);
                    result.complete(toResult(response, config));
                } catch (RuntimeException e) {
                    result.completeExceptionally(ProviderErrorClassifier.toSchedulerException(e));
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new ProviderTransientException(ProviderErrorClassifier.UNAVAILABLE,
                    "Model call executor is not accepting work", e));
            return result;
        }

        // Only a call that has not started yet is abandoned on cancellation.
        token.onCancel(() -> {
            if (claimed.compareAndSet(false, true)) {
                task.cancel(false);
                result.completeExceptionally(new CancellationException("Cancelled before the call started"));
                log.debug("[LLM] Dropped queued call to {}", config.getModelName());
            }
        });
        return result;
    }

    static ChatRequest toChatRequest(ModelPayload payload) {
        List<ChatMessage> messages = new ArrayList<>();
        for (ModelPayload.Message message : payload.getMessages()) {
            String role = message.getRole() != null ? message.getRole().toLowerCase(Locale.ROOT) : "user";
            switch (role) {
            case "system" -> messages.add(SystemMessage.from(message.getContent()));
            case "assistant" -> messages.add(AiMessage.from(message.getContent()));
            default -> messages.add(UserMessage.from(message.getContent()));
            }
        }
        ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
        if (payload.getTemperature() != null) {
            builder.temperature(payload.getTemperature());
        }
        if (payload.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(payload.getMaxOutputTokens());
        }
        return builder.build();
    }

    static ModelCallResult toResult(ChatResponse response, ModelConfig config) {
        long input = 0;
        long output = 0;
        long total = 0;
        TokenUsage usage = response.tokenUsage();
        if (usage != null) {
            input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
            output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
            total = usage.totalTokenCount() != null ? usage.totalTokenCount() : input + output;
        }
        String content = response.aiMessage() != null ? response.aiMessage().text() : null;
        return ModelCallResult.builder()
                .content(content)
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(total)
                .cost(config.costOf(input, output))
                .model(response.modelName() != null ? response.modelName() : config.getModelName())
                .build();
    }
}
