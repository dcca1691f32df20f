package me.golemcore.scheduler.queue;

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
import me.golemcore.scheduler.domain.model.QueueStats;

import java.time.Duration;

/**
 * Priority-ordered, scope-partitioned queue of admitted requests.
 *
 * <p>
 * Within a scope and tier entries leave in submission order. Within a tier
 * scopes are served round-robin. Higher tiers always go first, except that an
 * entry's effective tier rises by one for each full aging interval it has
 * waited.
 */
public interface RequestQueue {

    /**
     * Adds a descriptor.
     *
     * @throws me.golemcore.scheduler.domain.exception.QueueFullException
     *             when the total or per-scope bound is reached
     */
    void offer(RequestDescriptor descriptor);

    /**
     * Removes and returns the next descriptor, waiting up to {@code timeout}.
     * Returns {@code null} on timeout.
     */
    RequestDescriptor poll(Duration timeout) throws InterruptedException;

    /**
     * Removes a queued descriptor. Returns {@code false} when it is not queued.
     */
    boolean remove(RequestDescriptor descriptor);

    int size();

    /**
     * Queued entries for the scope's tenant and agent.
     */
    int sizeOf(IsolationScope scope);

    QueueStats getStats();
}
