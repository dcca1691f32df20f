package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.ModelCallResult;
import me.golemcore.scheduler.domain.model.ModelPayload;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the actual model call.
 */
public interface ModelInvokerPort {

    /**
     * Starts a model call and returns immediately.
     *
     * <p>
     * The future fails with
     * {@link me.golemcore.scheduler.domain.exception.ProviderTransientException}
     * or
     * {@link me.golemcore.scheduler.domain.exception.ProviderTerminalException}.
     * Once the provider call has started the future completes with the
     * provider's outcome even when the token is cancelled, so usage of work
     * actually performed reaches the caller. A call cancelled before it
     * started fails with {@link java.util.concurrent.CancellationException}.
     */
    CompletableFuture<ModelCallResult> invoke(ModelClient client, ModelPayload payload, Instant deadline,
            CancellationToken token);
}
