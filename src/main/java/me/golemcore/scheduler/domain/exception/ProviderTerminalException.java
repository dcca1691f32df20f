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
 * Non-retryable provider failure, e.g. a request the provider rejected as
 * malformed or an authentication error.
 */
public class ProviderTerminalException extends SchedulerException {

    private final String reasonCode;

    public ProviderTerminalException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    public ProviderTerminalException(String reasonCode, String message, Throwable cause) {
        super(SchedulerErrorKind.PROVIDER_TERMINAL, message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
