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

import me.golemcore.scheduler.domain.model.ModelCallResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One attempt's provider call. Usage of a successful call is recorded by
 * whichever path claims it first: the waiting worker, or the late-completion
 * hook installed when the call was abandoned.
 */
public final class InFlightCall {

    private final CompletableFuture<ModelCallResult> future;
    private final AtomicBoolean usageClaimed = new AtomicBoolean(false);

    public InFlightCall(CompletableFuture<ModelCallResult> future) {
        this.future = future;
    }

    public CompletableFuture<ModelCallResult> future() {
        return future;
    }

    public boolean claimUsage() {
        return usageClaimed.compareAndSet(false, true);
    }
}
