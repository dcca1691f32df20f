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
import me.golemcore.scheduler.domain.exception.SchedulerErrorKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable point-in-time view of a request descriptor.
 */
@Value
@Builder
public class RequestSnapshot {

    String requestId;
    IsolationScope scope;
    RequestPriority priority;
    RequestStatus status;
    long estimatedTokens;
    String idempotencyKey;
    Instant submittedAt;
    Instant deadline;
    Instant startedAt;
    Instant completedAt;
    int attemptCount;
    boolean cancelRequested;
    long tokensUsed;
    BigDecimal cost;
    SchedulerErrorKind errorKind;
    String errorMessage;
    ModelCallResult result;
}
