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

import me.golemcore.scheduler.domain.model.UsageDelta;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store of usage increments.
 */
public interface UsagePersistencePort {

    /**
     * Appends one usage increment. The returned future completes
     * exceptionally when the write failed.
     */
    CompletableFuture<Void> persistUsageDelta(UsageDelta delta);

    /**
     * Loads all increments recorded at or after {@code since}, across tenants.
     */
    List<UsageDelta> loadUsageSince(Instant since);
}
