package me.golemcore.scheduler.domain.exception;

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

/**
 * Base class of every failure the scheduler reports.
 *
 * <p>
 * Unchecked: validation, quota and capacity failures are thrown from
 * {@code submit}, all other kinds travel attached to the request descriptor
 * and are never thrown across the worker boundary.
 */
public class SchedulerException extends RuntimeException {

    private final SchedulerErrorKind kind;
    private final String requestId;

    public SchedulerException(SchedulerErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public SchedulerException(SchedulerErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public SchedulerException(SchedulerErrorKind kind, String message, String requestId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.requestId = requestId;
    }

    public SchedulerErrorKind getKind() {
        return kind;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
