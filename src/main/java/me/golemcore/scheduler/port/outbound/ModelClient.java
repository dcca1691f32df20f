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

import me.golemcore.scheduler.domain.model.ModelConfig;

/**
 * Live, reusable handle to a model provider, bound to one isolation scope and
 * provider. Handles are shared by concurrent requests of the same scope and
 * must be thread-safe.
 */
public interface ModelClient extends AutoCloseable {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Returns the configuration this handle was built from.
     */
    ModelConfig getConfig();

    /**
     * Checks if the handle can still serve calls.
     */
    boolean isAvailable();

    /**
     * Returns the underlying provider object when it is of the requested type.
     *
     * @throws IllegalStateException
     *             when the handle wraps something else
     */
    <T> T unwrap(Class<T> type);

    /**
     * Releases provider resources. Must be idempotent.
     *
     * <p>
     * The registry evicts handles (capacity, idle sweep, invalidation) without
     * tracking calls in flight, so closing must not abort a call already
     * dispatched through this handle. It only stops the handle from being
     * reported available.
     */
    @Override
    void close();
}
