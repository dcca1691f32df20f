package me.golemcore.scheduler.client;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.ProviderTerminalException;
import me.golemcore.scheduler.domain.exception.ProviderTransientException;
import me.golemcore.scheduler.domain.exception.SchedulerException;
import me.golemcore.scheduler.domain.model.ClientRegistryStats;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ModelClient;
import me.golemcore.scheduler.port.outbound.ModelClientFactoryPort;
import me.golemcore.scheduler.port.outbound.ModelConfigPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Caches provider handles per isolation scope and provider.
 *
 * <p>
 * Handles are keyed by {@code (scope.scopeKey(), providerId)} so one tenant's
 * credentials and model selection are never used for another tenant's call.
 * The cache is bounded by {@code maxEntries} (least recently used handles are
 * closed first) and a background sweep closes handles idle longer than
 * {@code idleTtl}.
 *
 * <p>
 * A cached handle that reports itself unavailable is evicted and rebuilt once.
 * If the rebuilt handle is unavailable too, the lookup fails with a
 * {@link ProviderTransientException} ({@code provider.unavailable}).
 *
 * <p>
 * Eviction closes a handle even while a worker is still calling through it;
 * {@link ModelClient#close()} leaves dispatched calls running.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ClientRegistry {

    private static final String LOG_PREFIX = "[Clients]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final ModelConfigPort modelConfigPort;
    private final List<ModelClientFactoryPort> factories;
    private final Clock clock;
    private final int maxEntries;
    private final Duration idleTtl;
    private final Duration sweepInterval;

    private final Map<ClientKey, CachedClient> cache = new ConcurrentHashMap<>();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    private ScheduledExecutorService sweepExecutor;

    @Autowired
    public ClientRegistry(ModelConfigPort modelConfigPort, List<ModelClientFactoryPort> factories,
            SchedulerProperties properties, Clock clock) {
        this(modelConfigPort, factories, clock, properties.getClients().getMaxEntries(),
                Duration.ofMillis(properties.getClients().getIdleTtlMs()),
                Duration.ofMillis(properties.getClients().getSweepIntervalMs()));
    }

    public ClientRegistry(ModelConfigPort modelConfigPort, List<ModelClientFactoryPort> factories, Clock clock,
            int maxEntries, Duration idleTtl, Duration sweepInterval) {
        this.modelConfigPort = modelConfigPort;
        this.factories = List.copyOf(factories);
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.idleTtl = idleTtl;
        this.sweepInterval = sweepInterval;
    }

    @PostConstruct
    public void init() {
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "client-idle-sweep");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1, sweepInterval.toMillis());
        sweepExecutor.scheduleAtFixedRate(this::evictIdle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} Registry started: maxEntries={}, idleTtl={}s", LOG_PREFIX, maxEntries, idleTtl.toSeconds());
    }

    @PreDestroy
    public void destroy() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
            try {
                sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        invalidateAll();
    }

    /**
     * Returns the handle for the provider configured for this scope.
     */
    public ModelClient getClient(IsolationScope scope) {
        ModelConfig config = modelConfigPort.resolveModelConfig(scope);
        return getClient(scope, config.getProviderId());
    }

    /**
     * Returns the cached handle for {@code (scope, providerId)}, creating it on
     * first use.
     */
    public ModelClient getClient(IsolationScope scope, String providerId) {
        ClientKey key = new ClientKey(scope.tenantId(), scope.scopeKey(), providerId);

        CachedClient cached = cache.get(key);
        if (cached != null) {
            if (cached.client().isAvailable()) {
                cached.touch(clock.instant());
                return cached.client();
            }
            log.warn("{} Cached client {} for {} is unavailable, rebuilding", LOG_PREFIX, providerId,
                    scope.scopeKey());
            evict(key, cached);
        }

        CachedClient fresh = cache.computeIfAbsent(key, k -> createClient(scope, providerId));
        if (!fresh.client().isAvailable()) {
            evict(key, fresh);
            throw new ProviderTransientException("provider.unavailable",
                    "Provider " + providerId + " is unavailable for " + scope.scopeKey());
        }
        fresh.touch(clock.instant());
        enforceCapacity();
        return fresh.client();
    }

    /**
     * Closes every handle of this scope's tenant and agent.
     */
    public int invalidate(IsolationScope scope) {
        String scopeKey = scope.scopeKey();
        return evictWhere(key -> key.scopeKey().equals(scopeKey), "scope " + scopeKey);
    }

    /**
     * Closes every handle of a tenant, across its agents.
     */
    public int invalidateTenant(String tenantId) {
        return evictWhere(key -> key.tenantId().equals(tenantId), "tenant " + tenantId);
    }

    public int invalidateAll() {
        return evictWhere(key -> true, "all scopes");
    }

    public int size() {
        return cache.size();
    }

    public ClientRegistryStats getStats() {
        Map<String, Integer> byProvider = new TreeMap<>();
        for (ClientKey key : cache.keySet()) {
            byProvider.merge(key.providerId(), 1, Integer::sum);
        }
        return ClientRegistryStats.builder()
                .cachedClients(cache.size())
                .clientsByProvider(byProvider)
                .created(created.get())
                .evicted(evicted.get())
                .build();
    }

    /**
     * Closes handles not used within the idle TTL.
     */
    void evictIdle() {
        Instant cutoff = clock.instant().minus(idleTtl);
        int count = 0;
        for (Map.Entry<ClientKey, CachedClient> entry : cache.entrySet()) {
            if (entry.getValue().lastUsedAt().isBefore(cutoff) && evict(entry.getKey(), entry.getValue())) {
                count++;
            }
        }
        if (count > 0) {
            log.debug("{} Evicted {} idle clients", LOG_PREFIX, count);
        }
    }

    private CachedClient createClient(IsolationScope scope, String providerId) {
        ModelConfig config = modelConfigPort.resolveModelConfig(scope);
        if (!providerId.equals(config.getProviderId())) {
            config = config.toBuilder().providerId(providerId).build();
        }
        ModelClientFactoryPort factory = factories.stream()
                .filter(f -> f.supports(providerId))
                .findFirst()
                .orElseThrow(() -> new ProviderTerminalException("provider.unsupported",
                        "No client factory for provider: " + providerId));
        ModelClient client;
        try {
            client = factory.create(scope, config);
        } catch (SchedulerException e) {
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ProviderTerminalException("provider.misconfigured",
                    "Cannot create " + providerId + " client: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ProviderTransientException("provider.client_init",
                    "Failed to create " + providerId + " client: " + e.getMessage(), e);
        }
        created.incrementAndGet();
        log.debug("{} Created {} client ({}) for {}", LOG_PREFIX, providerId, config.getModelName(),
                scope.scopeKey());
        return new CachedClient(scope.scopeKey(), providerId, client, clock.instant());
    }

    private void enforceCapacity() {
        int overflow = cache.size() - maxEntries;
        if (overflow <= 0) {
            return;
        }
        cache.entrySet().stream()
                .sorted(Comparator.comparing(entry -> entry.getValue().lastUsedAt()))
                .limit(overflow)
                .toList()
                .forEach(entry -> evict(entry.getKey(), entry.getValue()));
    }

    private int evictWhere(Predicate<ClientKey> filter, String description) {
        int count = 0;
        for (Map.Entry<ClientKey, CachedClient> entry : cache.entrySet()) {
            if (filter.test(entry.getKey()) && evict(entry.getKey(), entry.getValue())) {
                count++;
            }
        }
        if (count > 0) {
            log.info("{} Invalidated {} clients for {}", LOG_PREFIX, count, description);
        }
        return count;
    }

    private boolean evict(ClientKey key, CachedClient cached) {
        if (!cache.remove(key, cached)) {
            return false;
        }
        evicted.incrementAndGet();
        try {
            cached.client().close();
        } catch (RuntimeException e) {
            log.warn("{} Failed to close {} client for {}: {}", LOG_PREFIX, cached.providerId(), cached.scopeKey(),
                    e.getMessage());
        }
        log.debug("{} Closed {} client for {} (age {}s)", LOG_PREFIX, cached.providerId(), cached.scopeKey(),
                Duration.between(cached.createdAt(), clock.instant()).toSeconds());
        return true;
    }

    private record ClientKey(String tenantId, String scopeKey, String providerId) {
    }
}
