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
import me.golemcore.scheduler.domain.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Per-tenant usage ceiling.
 *
 * <p>
 * A limit of zero or less disables that dimension. Thresholds are fractions of
 * the limit: reaching {@code warningThreshold} raises
 * {@link QuotaAlertLevel#WARNING}, reaching {@code criticalThreshold} raises
 * {@link QuotaAlertLevel#CRITICAL}.
 */
@Value
@Builder(toBuilder = true)
public class QuotaPolicy {

    public static final long DEFAULT_DAILY_TOKEN_LIMIT = 1_000_000L;
    public static final BigDecimal DEFAULT_MONTHLY_COST_LIMIT = new BigDecimal("100.00");
    public static final long DEFAULT_DAILY_REQUEST_LIMIT = 10_000L;
    public static final double DEFAULT_WARNING_THRESHOLD = 0.8;
    public static final double DEFAULT_CRITICAL_THRESHOLD = 0.95;

    @Builder.Default
    long dailyTokenLimit = DEFAULT_DAILY_TOKEN_LIMIT;

    @Builder.Default
    BigDecimal monthlyCostLimit = DEFAULT_MONTHLY_COST_LIMIT;

    @Builder.Default
    long dailyRequestLimit = DEFAULT_DAILY_REQUEST_LIMIT;

    @Builder.Default
    double warningThreshold = DEFAULT_WARNING_THRESHOLD;

    @Builder.Default
    double criticalThreshold = DEFAULT_CRITICAL_THRESHOLD;

    public static QuotaPolicy defaults() {
        return QuotaPolicy.builder().build();
    }

    /**
     * Throws {@link ValidationException} when thresholds are outside
     * {@code 0 < warning <= critical <= 1}.
     */
    public QuotaPolicy validate() {
        if (warningThreshold <= 0.0 || warningThreshold > 1.0) {
            throw new ValidationException("warningThreshold must be in (0, 1]: " + warningThreshold);
        }
        if (criticalThreshold < warningThreshold || criticalThreshold > 1.0) {
            throw new ValidationException("criticalThreshold must be in [warningThreshold, 1]: " + criticalThreshold);
        }
        if (monthlyCostLimit == null) {
            throw new ValidationException("monthlyCostLimit must not be null");
        }
        return this;
    }

    public boolean limitsTokens() {
        return dailyTokenLimit > 0;
    }

    public boolean limitsRequests() {
        return dailyRequestLimit > 0;
    }

    public boolean limitsCost() {
        return monthlyCostLimit != null && monthlyCostLimit.signum() > 0;
    }
}
