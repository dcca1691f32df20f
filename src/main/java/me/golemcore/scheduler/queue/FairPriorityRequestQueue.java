package me.golemcore.scheduler.queue;

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
import me.golemcore.scheduler.domain.exception.QueueFullException;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.QueueStats;
import me.golemcore.scheduler.domain.model.RequestPriority;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link RequestQueue}.
 *
 * <p>
 * Each tier keeps one FIFO sub-queue per scope key ({@code tenant:agent}) and
 * a rotation of the scope keys that currently have entries. A poll takes the
 * head of the first scope in the rotation of the highest non-empty tier and
 * moves that scope to the back. Sub-queues stay sorted by submission
 * sequence, so an entry promoted by aging or re-queued for retry keeps its
 * place relative to its scope's other entries.
 *
 * <p>
 * All state is guarded by one lock, held only for queue mutation.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class FairPriorityRequestQueue implements RequestQueue {

    private static final String LOG_PREFIX = "[Queue]";
    private static final RequestPriority[] TIERS_DESCENDING = {
            RequestPriority.URGENT, RequestPriority.HIGH, RequestPriority.NORMAL, RequestPriority.LOW
    };

    private final Clock clock;
    private final int maxTotal;
    private final int maxPerScope;
    private final Duration agingInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Map<RequestPriority, Tier> tiers = new EnumMap<>(RequestPriority.class);
    private final Map<String, Entry> entries = new HashMap<>();
    private final Map<String, Integer> scopeCounts = new HashMap<>();

    private long offered;
    private long dispatched;
    private long rejected;
    private long promoted;

    @Autowired
    public FairPriorityRequestQueue(SchedulerProperties properties, Clock clock) {
        this(clock, properties.getQueue().getMaxTotal(), properties.getQueue().getMaxPerScope(),
                Duration.ofMillis(properties.getQueue().getAgingIntervalMs()));
    }

    public FairPriorityRequestQueue(Clock clock, int maxTotal, int maxPerScope, Duration agingInterval) {
        this.clock = clock;
        this.maxTotal = maxTotal;
        this.maxPerScope = maxPerScope;
        this.agingInterval = agingInterval;
        for (RequestPriority priority : RequestPriority.values()) {
            tiers.put(priority, new Tier());
        }
    }

    @Override
    public void offer(RequestDescriptor descriptor) {
        String scopeKey = descriptor.getScope().scopeKey();
        lock.lock();
        try {
            if (entries.containsKey(descriptor.getRequestId())) {
                return;
            }
            int scopeCount = scopeCounts.getOrDefault(scopeKey, 0);
            if (entries.size() >= maxTotal || scopeCount >= maxPerScope) {
                rejected++;
                log.warn("{} Rejected {} for {}: total={}/{}, scope={}/{}", LOG_PREFIX, descriptor.getRequestId(),
                        scopeKey, entries.size(), maxTotal, scopeCount, maxPerScope);
                throw new QueueFullException(scopeKey, descriptor.getRequestId());
            }
            Entry entry = new Entry(descriptor, scopeKey, clock.instant(), descriptor.getPriority());
            entries.put(descriptor.getRequestId(), entry);
            scopeCounts.merge(scopeKey, 1, Integer::sum);
            tiers.get(entry.tier).insert(entry);
            offered++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RequestDescriptor poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                applyAging(clock.instant());
                Entry entry = takeNext();
                if (entry != null) {
                    dispatched++;
                    return entry.descriptor;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(RequestDescriptor descriptor) {
        lock.lock();
        try {
            Entry entry = entries.get(descriptor.getRequestId());
            if (entry == null) {
                return false;
            }
            tiers.get(entry.tier).remove(entry);
            forget(entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int sizeOf(IsolationScope scope) {
        lock.lock();
        try {
            return scopeCounts.getOrDefault(scope.scopeKey(), 0);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStats getStats() {
        lock.lock();
        try {
            Map<RequestPriority, Integer> byTier = new EnumMap<>(RequestPriority.class);
            for (Map.Entry<RequestPriority, Tier> tier : tiers.entrySet()) {
                byTier.put(tier.getKey(), tier.getValue().size);
            }
            return QueueStats.builder()
                    .size(entries.size())
                    .activeScopes(scopeCounts.size())
                    .sizeByTier(byTier)
                    .offered(offered)
                    .dispatched(dispatched)
                    .rejected(rejected)
                    .promoted(promoted)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Internals (lock held) ====================

    private Entry takeNext() {
        for (RequestPriority priority : TIERS_DESCENDING) {
            Tier tier = tiers.get(priority);
            if (tier.size > 0) {
                Entry entry = tier.pollRoundRobin();
                forget(entry);
                return entry;
            }
        }
        return null;
    }

    private void forget(Entry entry) {
        entries.remove(entry.descriptor.getRequestId());
        scopeCounts.computeIfPresent(entry.scopeKey, (k, count) -> count > 1 ? count - 1 : null);
    }

    /**
     * Moves entries whose waiting time earned them a higher tier. Lower tiers
     * are processed first so an entry climbs at most to its earned tier in one
     * pass.
     */
    private void applyAging(Instant now) {
        if (agingInterval.isZero() || agingInterval.isNegative()) {
            return;
        }
        long intervalNanos = agingInterval.toNanos();
        for (int i = TIERS_DESCENDING.length - 1; i > 0; i--) {
            Tier tier = tiers.get(TIERS_DESCENDING[i]);
            if (tier.size == 0) {
                continue;
            }
            List<Entry> due = new ArrayList<>();
            for (ArrayDeque<Entry> queue : tier.byScope.values()) {
                for (Entry entry : queue) {
                    long waited = Duration.between(entry.enqueuedAt, now).toNanos();
                    RequestPriority earned = entry.basePriority.promote(waited / intervalNanos);
                    if (earned.compareTo(entry.tier) > 0) {
                        due.add(entry);
                    }
                }
            }
            for (Entry entry : due) {
                long waited = Duration.between(entry.enqueuedAt, now).toNanos();
                RequestPriority earned = entry.basePriority.promote(waited / intervalNanos);
                tier.remove(entry);
                RequestPriority from = entry.tier;
                entry.tier = earned;
                tiers.get(earned).insert(entry);
                promoted++;
                log.debug("{} Promoted {} from {} to {}", LOG_PREFIX, entry.descriptor.getRequestId(), from, earned);
            }
        }
    }

    private static final class Entry {
        private final RequestDescriptor descriptor;
        private final String scopeKey;
        private final Instant enqueuedAt;
        private final RequestPriority basePriority;
        private RequestPriority tier;

        private Entry(RequestDescriptor descriptor, String scopeKey, Instant enqueuedAt,
                RequestPriority basePriority) {
            this.descriptor = descriptor;
            this.scopeKey = scopeKey;
            this.enqueuedAt = enqueuedAt;
            this.basePriority = basePriority;
            this.tier = basePriority;
        }

        private long sequence() {
            return descriptor.getSequence();
        }
    }

    private static final class Tier {
        private final Map<String, ArrayDeque<Entry>> byScope = new LinkedHashMap<>();
        private final ArrayDeque<String> rotation = new ArrayDeque<>();
        private int size;

        private void insert(Entry entry) {
            ArrayDeque<Entry> queue = byScope.get(entry.scopeKey);
            if (queue == null) {
                queue = new ArrayDeque<>();
                byScope.put(entry.scopeKey, queue);
                rotation.addLast(entry.scopeKey);
            }
            if (queue.isEmpty() || queue.peekLast().sequence() < entry.sequence()) {
                queue.addLast(entry);
            } else {
                List<Entry> ordered = new ArrayList<>(queue);
                ListIterator<Entry> it = ordered.listIterator();
                while (it.hasNext()) {
                    if (it.next().sequence() > entry.sequence()) {
                        it.previous();
                        break;
                    }
                }
                it.add(entry);
                queue.clear();
                queue.addAll(ordered);
            }
            size++;
        }

        private Entry pollRoundRobin() {
            String scopeKey = rotation.pollFirst();
            ArrayDeque<Entry> queue = byScope.get(scopeKey);
            Entry entry = queue.pollFirst();
            if (queue.isEmpty()) {
                byScope.remove(scopeKey);
            } else {
                rotation.addLast(scopeKey);
            }
            size--;
            return entry;
        }

        private void remove(Entry entry) {
            ArrayDeque<Entry> queue = byScope.get(entry.scopeKey);
            if (queue == null) {
                return;
            }
            Iterator<Entry> it = queue.iterator();
            while (it.hasNext()) {
                if (it.next() == entry) {
                    it.remove();
                    size--;
                    break;
                }
            }
            if (queue.isEmpty()) {
                byScope.remove(entry.scopeKey);
                rotation.remove(entry.scopeKey);
            }
        }
    }
}
