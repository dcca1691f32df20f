package me.golemcore.scheduler;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore LLM Scheduler.
 *
 * <p>
 * The scheduler admits model calls on behalf of isolated tenants and agents,
 * enforces per-tenant quotas, and dispatches work fairly over a bounded worker
 * pool.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Isolation Scopes</b> - every request, client and usage record is
 * keyed by tenant and agent</li>
 * <li><b>Quotas</b> - daily token and request limits, monthly cost limits,
 * graded alerts</li>
 * <li><b>Fair Queueing</b> - strict priority tiers, round-robin across scopes,
 * aging against starvation</li>
 * <li><b>Client Cache</b> - one provider client per scope, bounded and
 * idle-evicted</li>
 * <li><b>Retries</b> - transient provider failures retried with exponential
 * backoff inside the request deadline</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound Port       → SchedulerPort
 * Domain Layer       → RequestManager, QuotaManager, RequestQueue, ClientRegistry
 * Outbound Adapters  → langchain4j clients, JSONL usage log, properties config
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code scheduler.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulerApplication.class, args);
    }

}
