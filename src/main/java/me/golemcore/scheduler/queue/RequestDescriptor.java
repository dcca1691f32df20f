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

import lombok.Getter;
import me.golemcore.scheduler.domain.exception.SchedulerException;
import me.golemcore.scheduler.domain.model.CancellationToken;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelCallResult;
import me.golemcore.scheduler.domain.model.ModelPayload;
import me.golemcore.scheduler.domain.model.RequestOutcome;
import me.golemcore.scheduler.domain.model.RequestPriority;
import me.golemcore.scheduler.domain.model.RequestSnapshot;
import me.golemcore.scheduler.domain.model.RequestStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * Canonical state of one scheduled request.
 *
 * <p>
 * Immutable identity fields are set at submission. Mutable state changes only
 * through the synchronized methods below, so a status transition and the
 * fields it implies are always observed together. The queue holds references
 * to descriptors for ordering only.
 */
public class RequestDescriptor {

    @Getter
    private final String requestId;
    @Getter
    private final IsolationScope scope;
    @Getter
    private final RequestPriority priority;
    @Getter
    private final ModelPayload payload;
    @Getter
    private final long estimatedTokens;
    @Getter
    private final String idempotencyKey;
    @Getter
    private final Instant submittedAt;
    @Getter
    private final Instant deadline;
    @Getter
    private final long sequence;
    @Getter
    private final CancellationToken cancellationToken = new CancellationToken();
    @Getter
    private final CompletableFuture<RequestOutcome> completion = new CompletableFuture<>();

    private RequestStatus status = RequestStatus.PENDING;
    private int attemptCount;
    private boolean cancelRequested;
    private Instant startedAt;
    private Instant completedAt;
    private long tokensUsed;
    private BigDecimal cost = BigDecimal.ZERO;
    private ModelCallResult result;
    private SchedulerException error;
    private InFlightCall inFlight;

    public RequestDescriptor(String requestId, IsolationScope scope, RequestPriority priority, ModelPayload payload,
            long estimatedTokens, String idempotencyKey, Instant submittedAt, Instant deadline, long sequence) {
        this.requestId = requestId;
        this.scope = scope;
        this.priority = priority;
        this.payload = payload;
        this.estimatedTokens = estimatedTokens;
        this.idempotencyKey = idempotencyKey;
        this.submittedAt = submittedAt;
        this.deadline = deadline;
        this.sequence = sequence;
    }

    public synchronized RequestStatus getStatus() {
        return status;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * Moves to {@code target} if the current status is one of {@code expected}.
     */
    public synchronized boolean transition(RequestStatus target, RequestStatus... expected) {
        if (!Arrays.asList(expected).contains(status)) {
            return false;
        }
        status = target;
        return true;
    }

    /**
     * ADMITTED to RUNNING for a new attempt.
     */
    public synchronized boolean startAttempt(Instant now) {
        if (status != RequestStatus.ADMITTED || cancelRequested) {
            return false;
        }
        status = RequestStatus.RUNNING;
        attemptCount++;
        if (startedAt == null) {
            startedAt = now;
        }
        return true;
    }

    public synchronized void attachInFlight(InFlightCall call) {
        this.inFlight = call;
    }

    public synchronized InFlightCall getInFlight() {
        return inFlight;
    }

    /**
     * Flags cancellation. Returns the status observed at the time of the call.
     */
    public synchronized RequestStatus requestCancel() {
        if (!status.isTerminal()) {
            cancelRequested = true;
        }
        return status;
    }

    public synchronized void addUsage(long tokens, BigDecimal callCost) {
        tokensUsed += tokens;
        cost = cost.add(callCost != null ? callCost : BigDecimal.ZERO);
    }

    /**
     * Terminal success. Only valid from RUNNING.
     */
    public boolean complete(ModelCallResult callResult, Instant now) {
        synchronized (this) {
            if (status != RequestStatus.RUNNING) {
                return false;
            }
            status = RequestStatus.COMPLETED;
            result = callResult;
            completedAt = now;
        }
        completion.complete(toOutcome());
        return true;
    }

    /**
     * Terminal failure of any kind (FAILED, TIMED_OUT, CANCELLED) if the current
     * status is one of {@code expected}.
     */
    public boolean fail(RequestStatus target, SchedulerException failure, Instant now, RequestStatus... expected) {
        synchronized (this) {
            if (!Arrays.asList(expected).contains(status)) {
                return false;
            }
            status = target;
            error = failure;
            completedAt = now;
        }
        completion.complete(toOutcome());
        return true;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    public synchronized RequestOutcome toOutcome() {
        return RequestOutcome.builder()
                .requestId(requestId)
                .status(status)
                .result(result)
                .error(error)
                .attemptCount(attemptCount)
                .tokensUsed(tokensUsed)
                .cost(cost)
                .build();
    }

    public synchronized RequestSnapshot snapshot() {
        return RequestSnapshot.builder()
                .requestId(requestId)
                .scope(scope)
                .priority(priority)
                .status(status)
                .estimatedTokens(estimatedTokens)
                .idempotencyKey(idempotencyKey)
                .submittedAt(submittedAt)
                .deadline(deadline)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .attemptCount(attemptCount)
                .cancelRequested(cancelRequested)
                .tokensUsed(tokensUsed)
                .cost(cost)
                .errorKind(error != null ? error.getKind() : null)
                .errorMessage(error != null ? error.getMessage() : null)
                .result(result)
                .build();
    }
}
