package me.golemcore.scheduler.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the scheduler, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link WorkersProperties} - worker pool size and poll interval</li>
 * <li>{@link QueueProperties} - capacity bounds and aging</li>
 * <li>{@link RequestsProperties} - timeouts, retries and retention</li>
 * <li>{@link QuotaProperties} - default tenant policy and persistence
 * retries</li>
 * <li>{@link ClientsProperties} - client cache bounds</li>
 * <li>{@link ModelsProperties} - default model and per-scope overrides</li>
 * <li>{@link ProviderProperties} - provider credentials by provider id</li>
 * <li>{@link StorageProperties} - usage log location</li>
 * </ul>
 *
 * <p>
 * Durations are expressed in milliseconds.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private WorkersProperties workers = new WorkersProperties();
    private QueueProperties queue = new QueueProperties();
    private RequestsProperties requests = new RequestsProperties();
    private QuotaProperties quota = new QuotaProperties();
    private ClientsProperties clients = new ClientsProperties();
    private ModelsProperties models = new ModelsProperties();
    private Map<String, ProviderProperties> providers = new HashMap<>();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class WorkersProperties {
        private int poolSize = 8;
        private long pollIntervalMs = 500;
        private long shutdownTimeoutMs = 10_000;
    }

    @Data
    public static class QueueProperties {
        private int maxTotal = 10_000;
        private int maxPerScope = 1_000;
        private long agingIntervalMs = 30_000;
    }

    @Data
    public static class RequestsProperties {
        private long defaultTimeoutMs = 300_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 10_000;
        private long defaultEstimatedTokens = 1_000;
        private long retentionTtlMs = 3_600_000;
        private long watchdogIntervalMs = 1_000;
        private long retentionSweepIntervalMs = 60_000;
    }

    @Data
    public static class QuotaProperties {
        private long dailyTokenLimit = 1_000_000;
        private BigDecimal monthlyCostLimit = new BigDecimal("100.00");
        private long dailyRequestLimit = 10_000;
        private double warningThreshold = 0.8;
        private double criticalThreshold = 0.95;
        private int maxAlertHistory = 1_000;
        private int persistMaxRetries = 3;
        private long persistInitialBackoffMs = 200;
        private boolean restoreOnStartup = true;
    }

    @Data
    public static class ClientsProperties {
        private int maxEntries = 1_000;
        private long idleTtlMs = 1_800_000;
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class ModelsProperties {
        private String defaultModel = "openai/gpt-4o-mini";
        /**
         * Keys are {@code tenant} or {@code tenant:agent}; values are catalog
         * model ids.
         */
        private Map<String, String> overrides = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private Long requestTimeoutMs;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/scheduler";
        private String usageDirectory = "usage";
    }
}
