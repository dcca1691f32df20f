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
import me.golemcore.scheduler.domain.exception.SchedulerException;

import java.math.BigDecimal;

/**
 * Final state of a request as returned by {@code awaitResult}.
 *
 * <p>
 * Exactly one of {@link #result} and {@link #error} is set for terminal
 * outcomes. A non-terminal status is returned when the caller's wait elapsed
 * before the request finished.
 */
@Value
@Builder
public class RequestOutcome {

    String requestId;
    RequestStatus status;
    ModelCallResult result;
    SchedulerException error;
    int attemptCount;
    long tokensUsed;
    BigDecimal cost;

    public boolean isSuccess() {
        return status == RequestStatus.COMPLETED && result != null;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public SchedulerErrorKind getErrorKind() {
        return error != null ? error.getKind() : null;
    }
}
