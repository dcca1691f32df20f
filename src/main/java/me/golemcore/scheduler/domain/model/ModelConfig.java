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
import java.math.RoundingMode;

/**
 * Resolved model selection for one scope: provider, model name, connection
 * parameters and pricing.
 */
@Value
@Builder(toBuilder = true)
public class ModelConfig {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
    private static final int COST_SCALE = 6;

    String providerId;
    String modelName;
    String apiKey;
    String baseUrl;

    @Builder.Default
    long timeoutMs = 60_000L;

    @Builder.Default
    BigDecimal priceInPerMillion = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal priceOutPerMillion = BigDecimal.ZERO;

    /**
     * Cost of a call, rounded to six decimal places.
     */
    public BigDecimal costOf(long inputTokens, long outputTokens) {
        BigDecimal in = BigDecimal.valueOf(Math.max(0, inputTokens)).multiply(priceInPerMillion);
        BigDecimal out = BigDecimal.valueOf(Math.max(0, outputTokens)).multiply(priceOutPerMillion);
        return in.add(out).divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }
}
