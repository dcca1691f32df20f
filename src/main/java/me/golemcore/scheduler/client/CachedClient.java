package me.golemcore.scheduler.client;

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

import me.golemcore.scheduler.port.outbound.ModelClient;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry entry: a live handle plus its usage timestamps.
 */
final class CachedClient {

    private final String scopeKey;
    private final String providerId;
    private final ModelClient client;
    private final Instant createdAt;
    private final AtomicReference<Instant> lastUsedAt;

    CachedClient(String scopeKey, String providerId, ModelClient client, Instant createdAt) {
        this.scopeKey = scopeKey;
        this.providerId = providerId;
        this.client = client;
        this.createdAt = createdAt;
        this.lastUsedAt = new AtomicReference<>(createdAt);
    }

    void touch(Instant now) {
        lastUsedAt.accumulateAndGet(now, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    String scopeKey() {
        return scopeKey;
    }

    String providerId() {
        return providerId;
    }

    ModelClient client() {
        return client;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastUsedAt() {
        return lastUsedAt.get();
    }
}
