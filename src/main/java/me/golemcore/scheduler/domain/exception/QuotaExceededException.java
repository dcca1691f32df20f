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

import me.golemcore.scheduler.domain.model.QuotaDimension;

/**
 * Admission denied because the tenant's projected usage exceeds its policy.
 * Terminal, never retried.
 */
public class QuotaExceededException extends SchedulerException {

    private final String tenantId;
    private final QuotaDimension dimension;

    public QuotaExceededException(String tenantId, QuotaDimension dimension, String requestId) {
        super(SchedulerErrorKind.QUOTA_EXCEEDED,
                "Quota exceeded for tenant " + tenantId + (dimension != null ? " (" + dimension.getLabel() + ")" : ""),
                requestId, null);
        this.tenantId = tenantId;
        this.dimension = dimension;
    }

    public String getTenantId() {
        return tenantId;
    }

    public QuotaDimension getDimension() {
        return dimension;
    }
}
