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

/**
 * Successful model response with the usage it consumed.
 */
@Value
@Builder
public class ModelCallResult {

    String content;
    long inputTokens;
    long outputTokens;
    long totalTokens;

    @Builder.Default
    BigDecimal cost = BigDecimal.ZERO;

    String model;

    /**
     * Total tokens, falling back to input plus output when the provider left
     * the total unset.
     */
    public long effectiveTotalTokens() {
        return totalTokens > 0 ? totalTokens : inputTokens + outputTokens;
    }
}
