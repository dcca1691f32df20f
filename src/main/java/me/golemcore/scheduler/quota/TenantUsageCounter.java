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

import me.golemcore.scheduler.domain.model.AgentUsage;
import me.golemcore.scheduler.domain.model.QuotaAlertLevel;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable running counters of one tenant. Every field is guarded by
 * {@link #lock}.
 */
final class TenantUsageCounter {

    final ReentrantLock lock = new ReentrantLock();

    private LocalDate day;
    private YearMonth month;
    private long tokensToday;
    private long requestsToday;
    private BigDecimal costThisMonth = BigDecimal.ZERO;
    private Instant lastDailyReset;
    private Instant lastMonthlyReset;
    private QuotaAlertLevel lastNotifiedLevel = QuotaAlertLevel.OK;
    private final Map<String, AgentCounter> agents = new HashMap<>();

    TenantUsageCounter(LocalDate day, YearMonth month, Instant now) {
        this.day = day;
        this.month = month;
        this.lastDailyReset = now;
        this.lastMonthlyReset = now;
    }

    /**
     * Resets the daily and monthly counters whose period id differs from the
     * current one. A second call within the same period changes nothing.
     */
    void rollOver(LocalDate currentDay, YearMonth currentMonth, Instant now) {
        if (!currentDay.equals(day)) {
            day = currentDay;
            tokensToday = 0;
            requestsToday = 0;
            lastDailyReset = now;
            lastNotifiedLevel = QuotaAlertLevel.OK;
            for (AgentCounter agent : agents.values()) {
                agent.tokensToday = 0;
                agent.requestsToday = 0;
            }
        }
        if (!currentMonth.equals(month)) {
            month = currentMonth;
            costThisMonth = BigDecimal.ZERO;
            lastMonthlyReset = now;
            for (AgentCounter agent : agents.values()) {
                agent.costThisMonth = BigDecimal.ZERO;
            }
        }
    }

    void add(String agentId, long tokens, BigDecimal cost) {
        tokensToday += tokens;
        requestsToday++;
        costThisMonth = costThisMonth.add(cost);
        AgentCounter agent = agents.computeIfAbsent(agentId, k -> new AgentCounter());
        agent.tokensToday += tokens;
        agent.requestsToday++;
        agent.costThisMonth = agent.costThisMonth.add(cost);
    }

    void addMonthlyCost(String agentId, BigDecimal cost) {
        costThisMonth = costThisMonth.add(cost);
        AgentCounter agent = agents.computeIfAbsent(agentId, k -> new AgentCounter());
        agent.costThisMonth = agent.costThisMonth.add(cost);
    }

    long tokensFor(LocalDate currentDay) {
        return currentDay.equals(day) ? tokensToday : 0;
    }

    long requestsFor(LocalDate currentDay) {
        return currentDay.equals(day) ? requestsToday : 0;
    }

    BigDecimal costFor(YearMonth currentMonth) {
        return currentMonth.equals(month) ? costThisMonth : BigDecimal.ZERO;
    }

    Map<String, AgentUsage> agentUsage(LocalDate currentDay, YearMonth currentMonth) {
        Map<String, AgentUsage> result = new LinkedHashMap<>();
        boolean sameDay = currentDay.equals(day);
        boolean sameMonth = currentMonth.equals(month);
        agents.forEach((agentId, agent) -> result.put(agentId, AgentUsage.builder()
                .agentId(agentId)
                .tokensUsedToday(sameDay ? agent.tokensToday : 0)
                .requestsToday(sameDay ? agent.requestsToday : 0)
                .costIncurredThisMonth(sameMonth ? agent.costThisMonth : BigDecimal.ZERO)
                .build()));
        return result;
    }

    Instant lastDailyReset() {
        return lastDailyReset;
    }

    Instant lastMonthlyReset() {
        return lastMonthlyReset;
    }

    QuotaAlertLevel lastNotifiedLevel() {
        return lastNotifiedLevel;
    }

    void lastNotifiedLevel(QuotaAlertLevel level) {
        this.lastNotifiedLevel = level;
    }

    private static final class AgentCounter {
        private long tokensToday;
        private long requestsToday;
        private BigDecimal costThisMonth = BigDecimal.ZERO;
    }
}
