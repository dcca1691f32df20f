package me.golemcore.scheduler.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;

/**
 * Read-only snapshot of a tenant's running usage counters.
 *
 * <p>
 * Daily counters belong to {@link #day}, the cost counter to {@link #month}.
 * A snapshot taken after a period boundary but before the next recorded usage
 * already reports the rolled-over (zero) values.
 *
 * @since 1.0
 */
@Value
@Builder
public class UsageStats {

    String tenantId;
    long tokensUsedToday;
    long requestsToday;
    BigDecimal costIncurredThisMonth;
    LocalDate day;
    YearMonth month;
    Instant lastDailyReset;
    Instant lastMonthlyReset;
    QuotaAlertLevel alertLevel;
    Map<String, AgentUsage> agentUsage;

    public static UsageStats empty(String tenantId, LocalDate day, YearMonth month) {
        return UsageStats.builder()
                .tenantId(tenantId)
                .tokensUsedToday(0)
                .requestsToday(0)
                .costIncurredThisMonth(BigDecimal.ZERO)
                .day(day)
                .month(month)
                .alertLevel(QuotaAlertLevel.OK)
                .agentUsage(Map.of())
                .build();
    }
}
