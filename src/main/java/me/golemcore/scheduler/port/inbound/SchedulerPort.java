package me.golemcore.scheduler.port.inbound;

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
import me.golemcore.scheduler.domain.model.ModelPayload;
import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.domain.model.QuotaPolicy;
import me.golemcore.scheduler.domain.model.RequestOutcome;
import me.golemcore.scheduler.domain.model.RequestPriority;
import me.golemcore.scheduler.domain.model.RequestSnapshot;
import me.golemcore.scheduler.domain.model.RequestStatus;
import me.golemcore.scheduler.domain.model.SchedulerStats;
import me.golemcore.scheduler.domain.model.SubmitRequest;
import me.golemcore.scheduler.domain.model.UsageStats;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * In-process entry point used by conversational application code to run
 * model calls and administer tenant quotas.
 *
 * <p>
 * Submission errors ({@code ValidationException}, {@code QuotaExceededException},
 * {@code QueueFullException}) are thrown synchronously. All later failures are
 * reported through {@link #awaitResult(String, Duration)} and
 * {@link #getStatus(String)}.
 */
public interface SchedulerPort {

    /**
     * Submits a model call and returns its request id.
     */
    String submit(IsolationScope scope, ModelPayload payload, RequestPriority priority, long estimatedTokens);

    String submit(SubmitRequest request);

    /**
     * Submits with a textual priority ({@code low}, {@code normal}, {@code high},
     * {@code urgent}; case-insensitive).
     */
    String submit(String tenantId, String agentId, ModelPayload payload, String priority, long estimatedTokens);

    /**
     * Waits for a request to finish, at most {@code timeout}.
     */
    RequestOutcome awaitResult(String requestId, Duration timeout);

    boolean cancel(String requestId);

    Optional<RequestSnapshot> getStatus(String requestId);

    /**
     * Lists a tenant's tracked requests, newest first, optionally only those in
     * the given status.
     */
    List<RequestSnapshot> listRequests(String tenantId, Optional<RequestStatus> status, int limit);

    void setPolicy(String tenantId, QuotaPolicy policy);

    QuotaPolicy getPolicy(String tenantId);

    UsageStats getUsage(String tenantId);

    /**
     * Drops cached provider clients of a scope, e.g. after its model
     * configuration changed.
     */
    int invalidate(IsolationScope scope);

    int invalidateTenant(String tenantId);

    int invalidateAll();

    List<QuotaAlert> getRecentAlerts(String tenantId, Duration within);

    SchedulerStats getStats();
}
