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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.PersistenceDegradedException;
import me.golemcore.scheduler.domain.model.UsageDelta;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.UsagePersistencePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Persists usage deltas off the caller's thread with exponential backoff
 * retry. After the last retry fails the delta is dropped from durable storage
 * (it stays counted in memory) and the dispatcher reports itself degraded until
 * a later write succeeds.
 */
@Component
@Slf4j
public class UsagePersistenceDispatcher {

    private final UsagePersistencePort persistencePort;
    private final int maxRetries;
    private final Duration firstBackoff;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    @Autowired
    public UsagePersistenceDispatcher(UsagePersistencePort persistencePort, SchedulerProperties properties) {
        this(persistencePort, properties.getQuota().getPersistMaxRetries(),
                Duration.ofMillis(properties.getQuota().getPersistInitialBackoffMs()));
    }

    UsagePersistenceDispatcher(UsagePersistencePort persistencePort, int maxRetries, Duration firstBackoff) {
        this.persistencePort = persistencePort;
        this.maxRetries = maxRetries;
        this.firstBackoff = firstBackoff;
    }

    /**
     * Builds the persist pipeline for one delta. The returned mono fails with
     * {@link PersistenceDegradedException} once retries are exhausted.
     */
    public Mono<Void> persist(UsageDelta delta) {
        return Mono.fromFuture(() -> persistencePort.persistUsageDelta(delta))
                .retryWhen(buildRetry()
                        .doBeforeRetry(signal -> log.warn(
                                "[Quota] Retrying usage persistence for tenant {} (attempt {}): {}",
                                delta.getTenantId(), signal.totalRetries() + 1,
                                signal.failure().getMessage())))
                .doOnSuccess(ignored -> {
                    if (degraded.compareAndSet(true, false)) {
                        log.info("[Quota] Usage persistence recovered");
                    }
                })
                .onErrorMap(Exceptions::isRetryExhausted, error -> {
                    degraded.set(true);
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.error("[Quota] Usage persistence failed for tenant {} after {} retries: {}",
                            delta.getTenantId(), maxRetries, cause.getMessage());
                    return new PersistenceDegradedException(delta.getTenantId(),
                            "Usage for tenant " + delta.getTenantId() + " kept in memory only", cause);
                })
                .then();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    protected RetryBackoffSpec buildRetry() {
        return Retry.backoff(maxRetries, firstBackoff);
    }
}
