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

/**
 * Ordered severity of a tenant's proximity to its usage ceiling. Computed on
 * demand, never stored.
 */
public enum QuotaAlertLevel {

    OK, WARNING, CRITICAL, EXCEEDED;

    public boolean isAtLeast(QuotaAlertLevel other) {
        return compareTo(other) >= 0;
    }

    public boolean isAdvisory() {
        return this == WARNING || this == CRITICAL;
    }

    public static QuotaAlertLevel max(QuotaAlertLevel a, QuotaAlertLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
