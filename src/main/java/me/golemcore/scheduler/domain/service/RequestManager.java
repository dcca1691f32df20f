package me.golemcore.scheduler.domain.service;

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
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.client.ClientRegistry;
import me.golemcore.scheduler.domain.exception.QueueFullException;
import me.golemcore.scheduler.domain.exception.QuotaExceededException;
import me.golemcore.scheduler.domain.exception.RequestCancelledException;
import me.golemcore.scheduler.domain.exception.RequestNotFoundException;
import me.golemcore.scheduler.domain.exception.RequestTimeoutException;
import me.golemcore.scheduler.domain.exception.SchedulerErrorKind;
import me.golemcore.scheduler.domain.exception.SchedulerException;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelCallResult;
import me.golemcore.scheduler.domain.model.QuotaCheck;
import me.golemcore.scheduler.domain.model.RequestManagerStats;
import me.golemcore.scheduler.domain.model.RequestOutcome;
import me.golemcore.scheduler.domain.model.RequestSnapshot;
import me.golemcore.scheduler.domain.model.RequestStatus;
import me.golemcore.scheduler.domain.model.SubmitRequest;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.ModelClient;
import me.golemcore.scheduler.port.outbound.ModelInvokerPort;
import me.golemcore.scheduler.quota.QuotaManager;
import me.golemcore.scheduler.queue.InFlightCall;
import me.golemcore.scheduler.queue.RequestDescriptor;
import me.golemcore.scheduler.queue.RequestQueue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admits, dispatches, retries, times out and cancels model calls.
 *
 * <p>
 * Submission is synchronous up to enqueue: validation, quota admission and
 * queue capacity failures are thrown to the caller. Everything after that is
 * attached to the request descriptor and observed through
 * {@link #awaitResult(String, Duration)} or {@link #getStatus(String)}.
 *
 * <p>
 * A fixed pool of workers polls the {@link RequestQueue}. No lock is held
 * while a provider call runs. A worker waits for a call no longer than the
 * request's hard deadline. A watchdog sweep times out requests that passed
 * their deadline in any non-terminal state, and a retention sweep evicts
 * finished requests nobody collected.
 *
 * <p>
 * Usage is recorded for every successful provider call, including calls whose
 * result is discarded because the request was cancelled or timed out first.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class RequestManager {

    private static final String LOG_PREFIX = "[Scheduler]";
    private static final RequestStatus[] NON_TERMINAL = {
            RequestStatus.PENDING, RequestStatus.ADMITTED, RequestStatus.RUNNING
    };

    private final RequestQueue queue;
    private final QuotaManager quotaManager;
    private final ClientRegistry clientRegistry;
    private final ModelInvokerPort modelInvoker;
    private final Settings settings;
    private final Clock clock;

    private final Map<String, RequestDescriptor> descriptors = new ConcurrentHashMap<>();
    private final Map<String, String> idempotencyIndex = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger();

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong quotaRejected = new AtomicLong();
    private final AtomicLong queueRejected = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();

    private ExecutorService workerPool;
    private ScheduledExecutorService housekeeping;

    @Autowired
    public RequestManager(RequestQueue queue, QuotaManager quotaManager, ClientRegistry clientRegistry,
            ModelInvokerPort modelInvoker, SchedulerProperties properties, Clock clock) {
        this(queue, quotaManager, clientRegistry, modelInvoker, Settings.from(properties), clock);
    }

    public RequestManager(RequestQueue queue, QuotaManager quotaManager, ClientRegistry clientRegistry,
            ModelInvokerPort modelInvoker, Settings settings, Clock clock) {
        this.queue = queue;
        this.quotaManager = quotaManager;
        this.clientRegistry = clientRegistry;
        this.modelInvoker = modelInvoker;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    public void init() {
        start();
    }

    /**
     * Starts the worker pool and the housekeeping sweeps. Requests submitted
     * before start wait in the queue.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger workerIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(settings.getPoolSize(), r -> {
            Thread t = new Thread(r, "request-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "request-housekeeping");
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < settings.getPoolSize(); i++) {
            workerPool.submit(this::workerLoop);
        }
        long watchdogMs = Math.max(1, settings.getWatchdogInterval().toMillis());
        housekeeping.scheduleWithFixedDelay(this::sweepExpired, watchdogMs, watchdogMs, TimeUnit.MILLISECONDS);
        long retentionMs = Math.max(1, settings.getRetentionSweepInterval().toMillis());
        housekeeping.scheduleWithFixedDelay(this::sweepRetention, retentionMs, retentionMs, TimeUnit.MILLISECONDS);
        log.info("{} Started {} workers (maxAttempts={}, defaultTimeout={}s)", LOG_PREFIX,
                settings.getPoolSize(), settings.getMaxAttempts(), settings.getDefaultTimeout().toSeconds());
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("{} Shutting down", LOG_PREFIX);
        housekeeping.shutdownNow();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Submission ====================

    /**
     * Validates, admits and enqueues a request.
     *
     * @return the request id, or the id of the live request already submitted
     *         with the same idempotency key in this scope
     * @throws ValidationException
     *             when the scope, payload or timeout is malformed
     * @throws QuotaExceededException
     *             when the tenant's projected usage exceeds its policy
     * @throws QueueFullException
     *             when the queue has no capacity left for the scope
     */
    public String submit(SubmitRequest request) {
        validate(request);
        IsolationScope scope = request.getScope();
        long estimatedTokens = request.getEstimatedTokens() >= 0 ? request.getEstimatedTokens()
                : settings.getDefaultEstimatedTokens();
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : settings.getDefaultTimeout();
        Instant now = clock.instant();

        RequestDescriptor descriptor = new RequestDescriptor(UUID.randomUUID().toString(), scope,
                request.getPriority(), request.getPayload(), estimatedTokens, request.getIdempotencyKey(), now,
                now.plus(timeout), sequence.incrementAndGet());

        // Every id in the idempotency index is already tracked in descriptors.
        descriptors.put(descriptor.getRequestId(), descriptor);
        String idempotencyKey = idempotencyKeyOf(scope, request.getIdempotencyKey());
        if (idempotencyKey != null) {
            String owner = idempotencyIndex.compute(idempotencyKey,
                    (key, existing) -> existing != null && descriptors.containsKey(existing)
                            ? existing
                            : descriptor.getRequestId());
            if (!owner.equals(descriptor.getRequestId())) {
                descriptors.remove(descriptor.getRequestId());
                log.debug("{} Duplicate submission for key {}, returning {}", LOG_PREFIX, idempotencyKey, owner);
                return owner;
            }
        }
        submitted.incrementAndGet();

        QuotaCheck check = quotaManager.evaluateAdmission(scope.tenantId(), estimatedTokens);
        if (check.isExceeded()) {
            QuotaExceededException error = new QuotaExceededException(scope.tenantId(), check.getDimension(),
                    descriptor.getRequestId());
            reject(descriptor, idempotencyKey, error, quotaRejected);
            log.warn("{} Rejected {} for {}: quota exceeded ({}, {}%)", LOG_PREFIX, descriptor.getRequestId(),
                    scope.scopeKey(), check.getDimension(), Math.round(check.getRatio() * 100));
            throw error;
        }
        if (check.getLevel().isAdvisory()) {
            quotaManager.notifyAdvisory(scope.tenantId(), check);
        }

        descriptor.transition(RequestStatus.ADMITTED, RequestStatus.PENDING);
        try {
            queue.offer(descriptor);
        } catch (QueueFullException e) {
            reject(descriptor, idempotencyKey, e, queueRejected);
            throw e;
        }

        log.debug("{} Submitted {} for {} (priority={}, estimate={})", LOG_PREFIX, descriptor.getRequestId(),
                scope.fullKey(), descriptor.getPriority(), estimatedTokens);
        return descriptor.getRequestId();
    }

    private void validate(SubmitRequest request) {
        if (request == null) {
            throw new ValidationException("request must not be null");
        }
        if (request.getScope() == null) {
            throw new ValidationException("scope must not be null");
        }
        if (request.getPayload() == null) {
            throw new ValidationException("payload must not be null");
        }
        if (request.getPriority() == null) {
            throw new ValidationException("priority must not be null");
        }
        if (request.getTimeout() != null && (request.getTimeout().isZero() || request.getTimeout().isNegative())) {
            throw new ValidationException("timeout must be positive: " + request.getTimeout());
        }
    }

    private void reject(RequestDescriptor descriptor, String idempotencyKey, SchedulerException error,
            AtomicLong counter) {
        descriptor.fail(RequestStatus.FAILED, error, clock.instant(), RequestStatus.PENDING, RequestStatus.ADMITTED);
        if (idempotencyKey != null) {
            idempotencyIndex.remove(idempotencyKey, descriptor.getRequestId());
        }
        counter.incrementAndGet();
    }

    private static String idempotencyKeyOf(IsolationScope scope, String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        return scope.scopeKey() + "#" + key;
    }

    // ==================== Results ====================

    /**
     * Waits up to {@code timeout} for the request to finish. A finished request
     * is evicted once returned; a request still in flight is returned with its
     * current status and keeps running.
     *
     * @throws RequestNotFoundException
     *             when the id is unknown or already evicted
     */
    public RequestOutcome awaitResult(String requestId, Duration timeout) {
        RequestDescriptor descriptor = descriptors.get(requestId);
        if (descriptor == null) {
            throw new RequestNotFoundException(requestId);
        }
        try {
            RequestOutcome outcome = descriptor.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            evict(descriptor);
            return outcome;
        } catch (TimeoutException e) {
            return descriptor.toOutcome();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return descriptor.toOutcome();
        } catch (ExecutionException e) {
            throw new SchedulerException(SchedulerErrorKind.INTERNAL, "Result future failed", requestId,
                    e.getCause());
        }
    }

    public Optional<RequestSnapshot> getStatus(String requestId) {
        return Optional.ofNullable(descriptors.get(requestId)).map(RequestDescriptor::snapshot);
    }

    /**
     * Tracked requests of a tenant, newest first. Requests already evicted
     * after result retrieval or retention are not listed.
     *
     * @throws ValidationException
     *             when the tenant id is blank or the limit is not positive
     */
    public List<RequestSnapshot> listRequests(String tenantId, Optional<RequestStatus> status, int limit) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId must not be blank");
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be positive: " + limit);
        }
        return descriptors.values().stream()
                .filter(descriptor -> descriptor.getScope().tenantId().equals(tenantId))
                .sorted(Comparator.comparingLong(RequestDescriptor::getSequence).reversed())
                .map(RequestDescriptor::snapshot)
                .filter(snapshot -> status.map(expected -> snapshot.getStatus() == expected).orElse(true))
                .limit(limit)
                .toList();
    }

    /**
     * Cancels a request. Queued requests are cancelled immediately and never
     * dispatched. For a running request the call's cancellation token is
     * signalled and the request ends CANCELLED once the call returns.
     *
     * @return {@code false} when the request is unknown or already finished
     */
    public boolean cancel(String requestId) {
        RequestDescriptor descriptor = descriptors.get(requestId);
        if (descriptor == null) {
            return false;
        }
        RequestStatus observed = descriptor.requestCancel();
        if (observed.isTerminal()) {
            return false;
        }
        if (observed == RequestStatus.PENDING || observed == RequestStatus.ADMITTED) {
            queue.remove(descriptor);
            if (descriptor.fail(RequestStatus.CANCELLED, new RequestCancelledException(requestId), clock.instant(),
                    RequestStatus.PENDING, RequestStatus.ADMITTED)) {
                cancelled.incrementAndGet();
                log.debug("{} Cancelled queued request {}", LOG_PREFIX, requestId);
                return true;
            }
        }
        descriptor.getCancellationToken().cancel();
        log.debug("{} Cancellation signalled for running request {}", LOG_PREFIX, requestId);
        return true;
    }

    public RequestManagerStats getStats() {
        int active = (int) descriptors.values().stream().filter(d -> !d.isTerminal()).count();
        return RequestManagerStats.builder()
                .submitted(submitted.get())
                .completed(completed.get())
                .failed(failed.get())
                .cancelled(cancelled.get())
                .timedOut(timedOut.get())
                .quotaRejected(quotaRejected.get())
                .queueRejected(queueRejected.get())
                .retried(retried.get())
                .tracked(descriptors.size())
                .active(active)
                .workers(activeWorkers.get())
                .running(running.get())
                .build();
    }

    // ==================== Workers ====================

    private void workerLoop() {
        activeWorkers.incrementAndGet();
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                RequestDescriptor descriptor = queue.poll(settings.getPollInterval());
                if (descriptor == null) {
                    continue;
                }
                try {
                    execute(descriptor);
                } catch (RuntimeException e) {
                    log.error("{} Unexpected failure executing {}", LOG_PREFIX, descriptor.getRequestId(), e);
                    failTerminal(descriptor, new SchedulerException(SchedulerErrorKind.INTERNAL,
                            "Internal scheduler error: " + e.getMessage(), descriptor.getRequestId(), e));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    void execute(RequestDescriptor descriptor) throws InterruptedException {
        Instant now = clock.instant();
        if (descriptor.isExpired(now)) {
            timeOut(descriptor);
            return;
        }
        if (!descriptor.startAttempt(now)) {
            return;
        }

        ModelClient client;
        InFlightCall call;
        try {
            client = clientRegistry.getClient(descriptor.getScope());
            call = new InFlightCall(modelInvoker.invoke(client, descriptor.getPayload(), descriptor.getDeadline(),
                    descriptor.getCancellationToken()));
        } catch (RuntimeException e) {
            handleFailure(descriptor, ProviderErrorClassifier.toSchedulerException(e));
            return;
        }
        descriptor.attachInFlight(call);
        log.debug("{} Dispatched {} (attempt {}) to {}", LOG_PREFIX, descriptor.getRequestId(),
                descriptor.getAttemptCount(), client.getProviderId());

        long waitMs = Math.max(0, Duration.between(clock.instant(), descriptor.getDeadline()).toMillis());
        CountDownLatch settled = new CountDownLatch(1);
        call.future().whenComplete((ignored, error) -> settled.countDown());
        descriptor.getCancellationToken().onCancel(settled::countDown);
        try {
            if (!settled.await(waitMs, TimeUnit.MILLISECONDS)) {
                timeOut(descriptor);
                return;
            }
        } catch (InterruptedException e) {
            failTerminal(descriptor, new SchedulerException(SchedulerErrorKind.INTERNAL,
                    "Worker interrupted while waiting for the provider", descriptor.getRequestId(), e));
            call.future().thenAccept(lateResult -> recordUsage(descriptor, call, lateResult));
            throw e;
        }
        if (!call.future().isDone()) {
            abandonRunningCall(descriptor, call);
            return;
        }

        ModelCallResult result;
        try {
            result = call.future().join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            handleFailure(descriptor, ProviderErrorClassifier.toSchedulerException(cause));
            return;
        }
        onSuccess(descriptor, call, result);
    }

    /**
     * The token fired while the provider call is still running. The request
     * finishes now; the call's usage is recorded when it returns.
     */
    private void abandonRunningCall(RequestDescriptor descriptor, InFlightCall call) {
        if (descriptor.fail(RequestStatus.CANCELLED, new RequestCancelledException(descriptor.getRequestId()),
                clock.instant(), RequestStatus.RUNNING)) {
            cancelled.incrementAndGet();
            log.debug("{} Request {} cancelled while its call is running", LOG_PREFIX, descriptor.getRequestId());
        }
        call.future().thenAccept(lateResult -> recordUsage(descriptor, call, lateResult));
    }

    private void onSuccess(RequestDescriptor descriptor, InFlightCall call, ModelCallResult result) {
        recordUsage(descriptor, call, result);
        Instant now = clock.instant();
        if (descriptor.isCancelRequested()) {
            if (descriptor.fail(RequestStatus.CANCELLED, new RequestCancelledException(descriptor.getRequestId()),
                    now, RequestStatus.RUNNING)) {
                cancelled.incrementAndGet();
                log.debug("{} Request {} completed after cancellation, result discarded", LOG_PREFIX,
                        descriptor.getRequestId());
            }
            return;
        }
        if (descriptor.complete(result, now)) {
            completed.incrementAndGet();
            log.debug("{} Completed {} after {} attempt(s), tokens={}", LOG_PREFIX, descriptor.getRequestId(),
                    descriptor.getAttemptCount(), result.effectiveTotalTokens());
        } else {
            log.debug("{} Late result for {} discarded (status {})", LOG_PREFIX, descriptor.getRequestId(),
                    descriptor.getStatus());
        }
    }

    private void recordUsage(RequestDescriptor descriptor, InFlightCall call, ModelCallResult result) {
        if (result == null || !call.claimUsage()) {
            return;
        }
        long tokens = result.effectiveTotalTokens();
        IsolationScope scope = descriptor.getScope();
        try {
            quotaManager.recordUsage(scope.tenantId(), scope.agentId(), descriptor.getRequestId(), tokens,
                    result.getCost());
        } catch (RuntimeException e) {
            log.error("{} Failed to record usage for {}: {}", LOG_PREFIX, descriptor.getRequestId(), e.getMessage());
        }
        descriptor.addUsage(tokens, result.getCost());
    }

    private void handleFailure(RequestDescriptor descriptor, SchedulerException error) {
        Instant now = clock.instant();
        if (descriptor.isCancelRequested()) {
            if (descriptor.fail(RequestStatus.CANCELLED, new RequestCancelledException(descriptor.getRequestId()),
                    now, RequestStatus.RUNNING)) {
                cancelled.incrementAndGet();
            }
            return;
        }

        int attempt = descriptor.getAttemptCount();
        Duration backoff = backoffFor(attempt);
        boolean canRetry = error.isRetryable()
                && attempt < settings.getMaxAttempts()
                && now.plus(backoff).isBefore(descriptor.getDeadline());
        if (canRetry && descriptor.transition(RequestStatus.ADMITTED, RequestStatus.RUNNING)) {
            retried.incrementAndGet();
            log.warn("{} Attempt {} of {} failed ({}), retrying in {}ms", LOG_PREFIX, attempt,
                    descriptor.getRequestId(), error.getMessage(), backoff.toMillis());
            scheduleRequeue(descriptor, backoff);
            return;
        }

        if (descriptor.fail(RequestStatus.FAILED, error, now, RequestStatus.RUNNING)) {
            failed.incrementAndGet();
            log.warn("{} Request {} failed after {} attempt(s): [{}] {}", LOG_PREFIX, descriptor.getRequestId(),
                    attempt, error.getKind().getCode(), error.getMessage());
        }
    }

    Duration backoffFor(int attempt) {
        double factor = Math.pow(settings.getBackoffMultiplier(), Math.max(0, attempt - 1));
        double millis = settings.getInitialBackoff().toMillis() * factor;
        long capped = (long) Math.min(millis, settings.getMaxBackoff().toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }

    private void scheduleRequeue(RequestDescriptor descriptor, Duration delay) {
        Runnable requeue = () -> {
            if (descriptor.getStatus() != RequestStatus.ADMITTED) {
                return;
            }
            try {
                queue.offer(descriptor);
            } catch (QueueFullException e) {
                if (descriptor.fail(RequestStatus.FAILED, e, clock.instant(), RequestStatus.ADMITTED)) {
                    failed.incrementAndGet();
                }
            }
        };
        try {
            housekeeping.schedule(requeue, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            requeue.run();
        }
    }

    private void timeOut(RequestDescriptor descriptor) {
        Duration timeout = Duration.between(descriptor.getSubmittedAt(), descriptor.getDeadline());
        if (descriptor.fail(RequestStatus.TIMED_OUT, new RequestTimeoutException(descriptor.getRequestId(), timeout),
                clock.instant(), NON_TERMINAL)) {
            timedOut.incrementAndGet();
            queue.remove(descriptor);
            descriptor.getCancellationToken().cancel();
            log.warn("{} Request {} timed out after {}ms (attempts={})", LOG_PREFIX, descriptor.getRequestId(),
                    timeout.toMillis(), descriptor.getAttemptCount());
        }
        // The watchdog may win before the worker attaches its call; either side installs the hook.
        InFlightCall call = descriptor.getInFlight();
        if (call != null && descriptor.getStatus() == RequestStatus.TIMED_OUT) {
            call.future().thenAccept(lateResult -> recordUsage(descriptor, call, lateResult));
        }
    }

    private void failTerminal(RequestDescriptor descriptor, SchedulerException error) {
        if (descriptor.fail(RequestStatus.FAILED, error, clock.instant(), NON_TERMINAL)) {
            failed.incrementAndGet();
            descriptor.getCancellationToken().cancel();
        }
    }

    // ==================== Housekeeping ====================

    /**
     * Times out every non-terminal request past its deadline.
     */
    void sweepExpired() {
        Instant now = clock.instant();
        for (RequestDescriptor descriptor : descriptors.values()) {
            if (!descriptor.isTerminal() && descriptor.isExpired(now)) {
                timeOut(descriptor);
            }
        }
    }

    /**
     * Evicts finished requests older than the retention TTL.
     */
    void sweepRetention() {
        Instant cutoff = clock.instant().minus(settings.getRetentionTtl());
        int evicted = 0;
        for (RequestDescriptor descriptor : descriptors.values()) {
            Instant completedAt = descriptor.getCompletedAt();
            if (descriptor.isTerminal() && completedAt != null && completedAt.isBefore(cutoff)) {
                evict(descriptor);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("{} Evicted {} finished requests past retention", LOG_PREFIX, evicted);
        }
    }

    private void evict(RequestDescriptor descriptor) {
        descriptors.remove(descriptor.getRequestId(), descriptor);
        String key = idempotencyKeyOf(descriptor.getScope(), descriptor.getIdempotencyKey());
        if (key != null) {
            idempotencyIndex.remove(key, descriptor.getRequestId());
        }
    }

    /**
     * Tunables of the request manager.
     */
    @Value
    @Builder(toBuilder = true)
    public static class Settings {

        @Builder.Default
        int poolSize = 8;
        @Builder.Default
        Duration pollInterval = Duration.ofMillis(500);
        @Builder.Default
        Duration shutdownTimeout = Duration.ofSeconds(10);
        @Builder.Default
        Duration defaultTimeout = Duration.ofMinutes(5);
        @Builder.Default
        int maxAttempts = 3;
        @Builder.Default
        Duration initialBackoff = Duration.ofMillis(500);
        @Builder.Default
        double backoffMultiplier = 2.0;
        @Builder.Default
        Duration maxBackoff = Duration.ofSeconds(10);
        @Builder.Default
        long defaultEstimatedTokens = 1_000;
        @Builder.Default
        Duration retentionTtl = Duration.ofHours(1);
        @Builder.Default
        Duration watchdogInterval = Duration.ofSeconds(1);
        @Builder.Default
        Duration retentionSweepInterval = Duration.ofMinutes(1);

        public static Settings from(SchedulerProperties properties) {
            SchedulerProperties.WorkersProperties workers = properties.getWorkers();
            SchedulerProperties.RequestsProperties requests = properties.getRequests();
            return Settings.builder()
                    .poolSize(workers.getPoolSize())
                    .pollInterval(Duration.ofMillis(workers.getPollIntervalMs()))
                    .shutdownTimeout(Duration.ofMillis(workers.getShutdownTimeoutMs()))
                    .defaultTimeout(Duration.ofMillis(requests.getDefaultTimeoutMs()))
                    .maxAttempts(requests.getMaxAttempts())
                    .initialBackoff(Duration.ofMillis(requests.getInitialBackoffMs()))
                    .backoffMultiplier(requests.getBackoffMultiplier())
                    .maxBackoff(Duration.ofMillis(requests.getMaxBackoffMs()))
                    .defaultEstimatedTokens(requests.getDefaultEstimatedTokens())
                    .retentionTtl(Duration.ofMillis(requests.getRetentionTtlMs()))
                    .watchdogInterval(Duration.ofMillis(requests.getWatchdogIntervalMs()))
                    .retentionSweepInterval(Duration.ofMillis(requests.getRetentionSweepIntervalMs()))
                    .build();
        }
    }
}
