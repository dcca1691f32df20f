package me.golemcore.scheduler.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.client.ClientRegistry;
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
import me.golemcore.scheduler.port.inbound.SchedulerPort;
import me.golemcore.scheduler.quota.QuotaManager;
import me.golemcore.scheduler.queue.RequestQueue;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link SchedulerPort}: a thin facade over the request manager, the
 * quota manager and the client registry.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
public class SchedulerService implements SchedulerPort {

    private final RequestManager requestManager;
    private final QuotaManager quotaManager;
    private final ClientRegistry clientRegistry;
    private final RequestQueue requestQueue;

    @Override
    public String submit(IsolationScope scope, ModelPayload payload, RequestPriority priority, long estimatedTokens) {
        return requestManager.submit(SubmitRequest.builder()
                .scope(scope)
                .payload(payload)
                .priority(priority)
                .estimatedTokens(estimatedTokens)
                .build());
    }

    @Override
    public String submit(SubmitRequest request) {
        return requestManager.submit(request);
    }

    @Override
    public String submit(String tenantId, String agentId, ModelPayload payload, String priority,
            long estimatedTokens) {
        return submit(IsolationScope.of(tenantId, agentId), payload, RequestPriority.fromValue(priority),
                estimatedTokens);
    }

    @Override
    public RequestOutcome awaitResult(String requestId, Duration timeout) {
        return requestManager.awaitResult(requestId, timeout);
    }

    @Override
    public boolean cancel(String requestId) {
        return requestManager.cancel(requestId);
    }

    @Override
    public Optional<RequestSnapshot> getStatus(String requestId) {
        return requestManager.getStatus(requestId);
    }

    @Override
    public List<RequestSnapshot> listRequests(String tenantId, Optional<RequestStatus> status, int limit) {
        return requestManager.listRequests(tenantId, status, limit);
    }

    @Override
    public void setPolicy(String tenantId, QuotaPolicy policy) {
        quotaManager.setPolicy(tenantId, policy);
    }

    @Override
    public QuotaPolicy getPolicy(String tenantId) {
        return quotaManager.getPolicy(tenantId);
    }

    @Override
    public UsageStats getUsage(String tenantId) {
        return quotaManager.getUsage(tenantId);
    }

    @Override
    public int invalidate(IsolationScope scope) {
        return clientRegistry.invalidate(scope);
    }

    @Override
    public int invalidateTenant(String tenantId) {
        return clientRegistry.invalidateTenant(tenantId);
    }

    @Override
    public int invalidateAll() {
        return clientRegistry.invalidateAll();
    }

    @Override
    public List<QuotaAlert> getRecentAlerts(String tenantId, Duration within) {
        return quotaManager.getRecentAlerts(tenantId, within);
    }

    @Override
    public SchedulerStats getStats() {
        return SchedulerStats.builder()
                .requests(requestManager.getStats())
                .queue(requestQueue.getStats())
                .clients(clientRegistry.getStats())
                .persistenceDegraded(quotaManager.isPersistenceDegraded())
                .build();
    }
}
