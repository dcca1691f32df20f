package me.golemcore.scheduler.quota;

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

import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.domain.model.QuotaAlertLevel;
import me.golemcore.scheduler.domain.model.QuotaCheck;
import me.golemcore.scheduler.domain.model.QuotaPolicy;
import me.golemcore.scheduler.domain.model.UsageStats;
import me.golemcore.scheduler.port.outbound.QuotaAlertListener;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Per-tenant usage accounting and admission control.
 *
 * <p>
 * Counters are the in-process source of truth for admission. They reset
 * lazily at the local-day (tokens, requests) and calendar-month (cost)
 * boundary on the next access.
 */
public interface QuotaManager {

    /**
     * Replaces the tenant's policy. Counters are not touched.
     */
    void setPolicy(String tenantId, QuotaPolicy policy);

    /**
     * Returns the tenant's registered policy, or the default policy.
     */
    QuotaPolicy getPolicy(String tenantId);

    /**
     * Evaluates projected usage of one more call consuming
     * {@code estimatedTokens}. Never mutates state.
     */
    QuotaCheck evaluateAdmission(String tenantId, long estimatedTokens);

    /**
     * Shorthand for {@code evaluateAdmission(...).getLevel()}.
     */
    default QuotaAlertLevel checkAdmission(String tenantId, long estimatedTokens) {
        return evaluateAdmission(tenantId, estimatedTokens).getLevel();
    }

    /**
     * Adds one call's usage to the current period and persists the delta
     * asynchronously.
     */
    void recordUsage(String tenantId, String agentId, String requestId, long tokensUsed, BigDecimal cost);

    default void recordUsage(String tenantId, String agentId, long tokensUsed, BigDecimal cost) {
        recordUsage(tenantId, agentId, null, tokensUsed, cost);
    }

    /**
     * Notifies listeners of an advisory admission level (WARNING or CRITICAL)
     * unless that level was already notified this period.
     */
    void notifyAdvisory(String tenantId, QuotaCheck check);

    UsageStats getUsage(String tenantId);

    /**
     * Alerts raised within {@code within}, newest last. A {@code null} tenant
     * returns alerts of all tenants.
     */
    List<QuotaAlert> getRecentAlerts(String tenantId, Duration within);

    void addAlertListener(QuotaAlertListener listener);

    void removeAlertListener(QuotaAlertListener listener);

    /**
     * Whether the most recent usage persistence exhausted its retries.
     */
    boolean isPersistenceDegraded();
}
