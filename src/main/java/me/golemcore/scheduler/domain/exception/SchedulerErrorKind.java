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
 * Stable classification of scheduler failures.
 *
 * <p>
 * Callers use the kind to choose their messaging: {@link #QUOTA_EXCEEDED} is
 * an upgrade prompt, {@link #PROVIDER_TRANSIENT} and {@link #TIMEOUT} are
 * "try again later".
 */
public enum SchedulerErrorKind {

    VALIDATION("scheduler.validation", false),
    QUOTA_EXCEEDED("scheduler.quota_exceeded", false),
    QUEUE_FULL("scheduler.queue_full", false),
    PROVIDER_TRANSIENT("provider.transient", true),
    PROVIDER_TERMINAL("provider.terminal", false),
    TIMEOUT("scheduler.timeout", false),
    CANCELLED("scheduler.cancelled", false),
    PERSISTENCE_DEGRADED("usage.persistence_degraded", false),
    NOT_FOUND("scheduler.not_found", false),
    INTERNAL("scheduler.internal", false);

    private final String code;
    private final boolean retryable;

    SchedulerErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
