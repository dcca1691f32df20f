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

/**
 * Result of evaluating a tenant's usage against its policy: the resulting
 * level and the dimension that determined it.
 */
@Value
@Builder
public class QuotaCheck {

    QuotaAlertLevel level;
    QuotaDimension dimension;
    double ratio;
    double currentUsage;
    double limit;

    public static QuotaCheck ok() {
        return QuotaCheck.builder()
                .level(QuotaAlertLevel.OK)
                .build();
    }

    public boolean isExceeded() {
        return level == QuotaAlertLevel.EXCEEDED;
    }
}
