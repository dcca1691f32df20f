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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.PersistenceDegradedException;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.domain.model.QuotaAlertLevel;
import me.golemcore.scheduler.domain.model.QuotaCheck;
import me.golemcore.scheduler.domain.model.QuotaDimension;
import me.golemcore.scheduler.domain.model.QuotaPolicy;
import me.golemcore.scheduler.domain.model.UsageDelta;
import me.golemcore.scheduler.domain.model.UsageStats;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.QuotaAlertListener;
import me.golemcore.scheduler.port.outbound.UsagePersistencePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link QuotaManager}: in-memory per-tenant counters, each guarded by
 * its own lock, with asynchronous durable persistence.
 *
 * <p>
 * Admission uses projected ratios: tokens {@code (used + estimated) / limit},
 * requests {@code (count + 1) / limit}, cost {@code spent / limit}. A projected
 * token or request ratio above 1.0, or a cost ratio of 1.0 or more, is
 * {@link QuotaAlertLevel#EXCEEDED}. After recording, any ratio of 1.0 or more
 * is EXCEEDED.
 *
 * <p>
 * Listeners hear about a level once per day: when the level rises above the
 * highest level already notified since the last daily reset.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class TenantQuotaManager implements QuotaManager {

    private static final String LOG_PREFIX = "[Quota]";
    private static final String UNKNOWN_AGENT = "unknown";
    private static final int ALERT_HISTORY_TRIM_DIVISOR = 2;

    private final UsagePersistencePort persistencePort;
    private final UsagePersistenceDispatcher dispatcher;
    private final Clock clock;
    private final QuotaPolicy defaultPolicy;
    private final int maxAlertHistory;
    private final boolean restoreOnStartup;

    private final Map<String, QuotaPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, TenantUsageCounter> counters = new ConcurrentHashMap<>();
    private final List<QuotaAlertListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<QuotaAlert> alertHistory = new ArrayDeque<>();

    @Autowired
    public TenantQuotaManager(UsagePersistencePort persistencePort, UsagePersistenceDispatcher dispatcher,
            List<QuotaAlertListener> listeners, SchedulerProperties properties, Clock clock) {
        this(persistencePort, dispatcher, clock, defaultPolicy(properties.getQuota()),
                properties.getQuota().getMaxAlertHistory(), properties.getQuota().isRestoreOnStartup());
        this.listeners.addAll(listeners);
    }

    public TenantQuotaManager(UsagePersistencePort persistencePort, UsagePersistenceDispatcher dispatcher,
            Clock clock, QuotaPolicy defaultPolicy, int maxAlertHistory, boolean restoreOnStartup) {
        this.persistencePort = persistencePort;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.defaultPolicy = defaultPolicy.validate();
        this.maxAlertHistory = maxAlertHistory;
        this.restoreOnStartup = restoreOnStartup;
    }

    private static QuotaPolicy defaultPolicy(SchedulerProperties.QuotaProperties quota) {
        return QuotaPolicy.builder()
                .dailyTokenLimit(quota.getDailyTokenLimit())
                .monthlyCostLimit(quota.getMonthlyCostLimit())
                .dailyRequestLimit(quota.getDailyRequestLimit())
                .warningThreshold(quota.getWarningThreshold())
                .criticalThreshold(quota.getCriticalThreshold())
                .build();
    }

    @PostConstruct
    public void init() {
        if (restoreOnStartup) {
            restoreFromPersistence();
        }
    }

    // ==================== Policies ====================

    @Override
    public void setPolicy(String tenantId, QuotaPolicy policy) {
        requireTenant(tenantId);
        if (policy == null) {
            throw new ValidationException("policy must not be null");
        }
        policies.put(tenantId, policy.validate());
        log.info("{} Policy updated for tenant {}: tokens/day={}, cost/month={}, requests/day={}",
                LOG_PREFIX, tenantId, policy.getDailyTokenLimit(), policy.getMonthlyCostLimit(),
                policy.getDailyRequestLimit());
    }

    @Override
    public QuotaPolicy getPolicy(String tenantId) {
        return policies.getOrDefault(tenantId, defaultPolicy);
    }

    // ==================== Admission ====================

    @Override
    public QuotaCheck evaluateAdmission(String tenantId, long estimatedTokens) {
        requireTenant(tenantId);
        QuotaPolicy policy = getPolicy(tenantId);
        Instant now = clock.instant();
        LocalDate day = QuotaPeriod.dayOf(now, zone());
        YearMonth month = QuotaPeriod.monthOf(now, zone());
        long estimate = Math.max(0, estimatedTokens);

        TenantUsageCounter counter = counters.get(tenantId);
        long tokens = 0;
        long requests = 0;
        BigDecimal cost = BigDecimal.ZERO;
        if (counter != null) {
            counter.lock.lock();
            try {
                tokens = counter.tokensFor(day);
                requests = counter.requestsFor(day);
                cost = counter.costFor(month);
            } finally {
                counter.lock.unlock();
            }
        }
        return evaluate(policy, tokens + estimate, requests + 1, cost, true);
    }

    @Override
    public void notifyAdvisory(String tenantId, QuotaCheck check) {
        if (check == null || !check.getLevel().isAdvisory()) {
            return;
        }
        Instant now = clock.instant();
        TenantUsageCounter counter = counterFor(tenantId, now);
        QuotaAlert alert;
        counter.lock.lock();
        try {
            counter.rollOver(QuotaPeriod.dayOf(now, zone()), QuotaPeriod.monthOf(now, zone()), now);
            alert = escalate(tenantId, counter, check, now);
        } finally {
            counter.lock.unlock();
        }
        publish(alert);
    }

    // ==================== Recording ====================

    @Override
    public void recordUsage(String tenantId, String agentId, String requestId, long tokensUsed, BigDecimal cost) {
        requireTenant(tenantId);
        String agent = agentId != null ? agentId : UNKNOWN_AGENT;
        long tokens = Math.max(0, tokensUsed);
        BigDecimal safeCost = cost != null && cost.signum() > 0 ? cost : BigDecimal.ZERO;
        QuotaPolicy policy = getPolicy(tenantId);
        Instant now = clock.instant();
        LocalDate day = QuotaPeriod.dayOf(now, zone());
        YearMonth month = QuotaPeriod.monthOf(now, zone());

        TenantUsageCounter counter = counterFor(tenantId, now);
        QuotaAlert alert;
        counter.lock.lock();
        try {
            counter.rollOver(day, month, now);
            counter.add(agent, tokens, safeCost);
            QuotaCheck check = evaluate(policy, counter.tokensFor(day), counter.requestsFor(day),
                    counter.costFor(month), false);
            alert = escalate(tenantId, counter, check, now);
        } finally {
            counter.lock.unlock();
        }

        log.debug("{} Recorded usage: tenant={}, agent={}, tokens={}, cost={}", LOG_PREFIX, tenantId, agent,
                tokens, safeCost);
        publish(alert);

        UsageDelta delta = UsageDelta.builder()
                .tenantId(tenantId)
                .agentId(agent)
                .requestId(requestId)
                .tokens(tokens)
                .cost(safeCost)
                .timestamp(now)
                .build();
        dispatcher.persist(delta).subscribe(null, this::onPersistenceFailure);
    }

    private void onPersistenceFailure(Throwable error) {
        if (!(error instanceof PersistenceDegradedException degraded)) {
            log.error("{} Unexpected usage persistence failure: {}", LOG_PREFIX, error.getMessage());
            return;
        }
        for (QuotaAlertListener listener : listeners) {
            try {
                listener.onPersistenceDegraded(degraded);
            } catch (RuntimeException e) {
                log.warn("{} Alert listener failed: {}", LOG_PREFIX, e.getMessage());
            }
        }
    }

    // ==================== Queries ====================

    @Override
    public UsageStats getUsage(String tenantId) {
        requireTenant(tenantId);
        Instant now = clock.instant();
        LocalDate day = QuotaPeriod.dayOf(now, zone());
        YearMonth month = QuotaPeriod.monthOf(now, zone());
        TenantUsageCounter counter = counters.get(tenantId);
        if (counter == null) {
            return UsageStats.empty(tenantId, day, month);
        }

        counter.lock.lock();
        try {
            long tokens = counter.tokensFor(day);
            long requests = counter.requestsFor(day);
            BigDecimal cost = counter.costFor(month);
            return UsageStats.builder()
                    .tenantId(tenantId)
                    .tokensUsedToday(tokens)
                    .requestsToday(requests)
                    .costIncurredThisMonth(cost)
                    .day(day)
                    .month(month)
                    .lastDailyReset(counter.lastDailyReset())
                    .lastMonthlyReset(counter.lastMonthlyReset())
                    .alertLevel(evaluate(getPolicy(tenantId), tokens, requests, cost, false).getLevel())
                    .agentUsage(counter.agentUsage(day, month))
                    .build();
        } finally {
            counter.lock.unlock();
        }
    }

    @Override
    public List<QuotaAlert> getRecentAlerts(String tenantId, Duration within) {
        Instant cutoff = clock.instant().minus(within);
        synchronized (alertHistory) {
            return alertHistory.stream()
                    .filter(alert -> tenantId == null || tenantId.equals(alert.getTenantId()))
                    .filter(alert -> !alert.getTimestamp().isBefore(cutoff))
                    .toList();
        }
    }

    @Override
    public void addAlertListener(QuotaAlertListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeAlertListener(QuotaAlertListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean isPersistenceDegraded() {
        return dispatcher.isDegraded();
    }

    // ==================== Restore ====================

    /**
     * Replays persisted deltas of the current month into the counters. Deltas
     * are not persisted again and no alerts are raised.
     */
    public void restoreFromPersistence() {
        Instant now = clock.instant();
        LocalDate day = QuotaPeriod.dayOf(now, zone());
        YearMonth month = QuotaPeriod.monthOf(now, zone());
        List<UsageDelta> deltas;
        try {
            deltas = persistencePort.loadUsageSince(QuotaPeriod.startOfMonth(now, zone()));
        } catch (RuntimeException e) {
            log.warn("{} Failed to restore persisted usage: {}", LOG_PREFIX, e.getMessage());
            return;
        }

        int restored = 0;
        for (UsageDelta delta : deltas) {
            if (delta.getTenantId() == null || delta.getTimestamp() == null) {
                continue;
            }
            LocalDate deltaDay = QuotaPeriod.dayOf(delta.getTimestamp(), zone());
            if (!YearMonth.from(deltaDay).equals(month)) {
                continue;
            }
            BigDecimal cost = delta.getCost() != null ? delta.getCost() : BigDecimal.ZERO;
            String agent = delta.getAgentId() != null ? delta.getAgentId() : UNKNOWN_AGENT;
            TenantUsageCounter counter = counterFor(delta.getTenantId(), now);
            counter.lock.lock();
            try {
                counter.rollOver(day, month, now);
                if (deltaDay.equals(day)) {
                    counter.add(agent, Math.max(0, delta.getTokens()), cost);
                } else {
                    counter.addMonthlyCost(agent, cost);
                }
            } finally {
                counter.lock.unlock();
            }
            restored++;
        }

        for (Map.Entry<String, TenantUsageCounter> entry : counters.entrySet()) {
            TenantUsageCounter counter = entry.getValue();
            counter.lock.lock();
            try {
                QuotaCheck check = evaluate(getPolicy(entry.getKey()), counter.tokensFor(day),
                        counter.requestsFor(day), counter.costFor(month), false);
                counter.lastNotifiedLevel(check.getLevel());
            } finally {
                counter.lock.unlock();
            }
        }
        log.info("{} Restored {} usage records for {} tenants", LOG_PREFIX, restored, counters.size());
    }

    // ==================== Internals ====================

    private TenantUsageCounter counterFor(String tenantId, Instant now) {
        return counters.computeIfAbsent(tenantId,
                k -> new TenantUsageCounter(QuotaPeriod.dayOf(now, zone()), QuotaPeriod.monthOf(now, zone()), now));
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    /**
     * Caller holds the counter's lock.
     */
    private QuotaAlert escalate(String tenantId, TenantUsageCounter counter, QuotaCheck check, Instant now) {
        QuotaAlertLevel previous = counter.lastNotifiedLevel();
        if (check.getLevel().compareTo(previous) <= 0) {
            return null;
        }
        counter.lastNotifiedLevel(check.getLevel());
        return QuotaAlert.builder()
                .tenantId(tenantId)
                .previousLevel(previous)
                .level(check.getLevel())
                .dimension(check.getDimension())
                .usageRatio(check.getRatio())
                .currentUsage(check.getCurrentUsage())
                .limit(check.getLimit())
                .message(String.format("Tenant %s reached %s on %s: %.1f%% of limit", tenantId, check.getLevel(),
                        check.getDimension().getLabel(), check.getRatio() * 100))
                .timestamp(now)
                .build();
    }

    private void publish(QuotaAlert alert) {
        if (alert == null) {
            return;
        }
        synchronized (alertHistory) {
            alertHistory.addLast(alert);
            if (alertHistory.size() > maxAlertHistory) {
                int keep = Math.max(1, maxAlertHistory / ALERT_HISTORY_TRIM_DIVISOR);
                while (alertHistory.size() > keep) {
                    alertHistory.removeFirst();
                }
            }
        }
        log.warn("{} {}", LOG_PREFIX, alert.getMessage());
        for (QuotaAlertListener listener : listeners) {
            try {
                listener.onQuotaAlert(alert);
            } catch (RuntimeException e) {
                log.warn("{} Alert listener failed: {}", LOG_PREFIX, e.getMessage());
            }
        }
    }

    static QuotaCheck evaluate(QuotaPolicy policy, long tokens, long requests, BigDecimal cost, boolean projected) {
        QuotaCheck result = QuotaCheck.ok();
        if (policy.limitsTokens()) {
            result = worse(result, check(policy, QuotaDimension.DAILY_TOKENS, tokens,
                    policy.getDailyTokenLimit(), projected));
        }
        if (policy.limitsCost()) {
            double limit = policy.getMonthlyCostLimit().doubleValue();
            double ratio = cost.divide(policy.getMonthlyCostLimit(), MathContext.DECIMAL64).doubleValue();
            result = worse(result, levelOf(policy, QuotaDimension.MONTHLY_COST, ratio, cost.doubleValue(), limit,
                    false));
        }
        if (policy.limitsRequests()) {
            result = worse(result, check(policy, QuotaDimension.DAILY_REQUESTS, requests,
                    policy.getDailyRequestLimit(), projected));
        }
        return result;
    }

    private static QuotaCheck check(QuotaPolicy policy, QuotaDimension dimension, long usage, long limit,
            boolean projected) {
        double ratio = (double) usage / (double) limit;
        return levelOf(policy, dimension, ratio, usage, limit, projected);
    }

    private static QuotaCheck levelOf(QuotaPolicy policy, QuotaDimension dimension, double ratio, double usage,
            double limit, boolean strictlyAboveLimit) {
        QuotaAlertLevel level;
        boolean exceeded = strictlyAboveLimit ? ratio > 1.0 : ratio >= 1.0;
        if (exceeded) {
            level = QuotaAlertLevel.EXCEEDED;
        } else if (ratio >= policy.getCriticalThreshold()) {
            level = QuotaAlertLevel.CRITICAL;
        } else if (ratio >= policy.getWarningThreshold()) {
            level = QuotaAlertLevel.WARNING;
        } else {
            level = QuotaAlertLevel.OK;
        }
        return QuotaCheck.builder()
                .level(level)
                .dimension(dimension)
                .ratio(ratio)
                .currentUsage(usage)
                .limit(limit)
                .build();
    }

    private static QuotaCheck worse(QuotaCheck current, QuotaCheck candidate) {
        int byLevel = candidate.getLevel().compareTo(current.getLevel());
        if (byLevel > 0 || (byLevel == 0 && candidate.getRatio() > current.getRatio())) {
            return candidate;
        }
        return current;
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId must not be empty");
        }
    }
}
