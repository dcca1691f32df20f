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
 * The scope's sub-queue or the whole queue is at capacity.
 */
public class QueueFullException extends SchedulerException {

    private final String scopeKey;

    public QueueFullException(String scopeKey, String requestId) {
        super(SchedulerErrorKind.QUEUE_FULL, "Request queue is full for scope " + scopeKey, requestId, null);
        this.scopeKey = scopeKey;
    }

    public String getScopeKey() {
        return scopeKey;
    }
}
