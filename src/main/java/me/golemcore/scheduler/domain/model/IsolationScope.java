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

import me.golemcore.scheduler.domain.exception.ValidationException;

/**
 * Four-part isolation key that tags every request, cached client and usage
 * record.
 *
 * <p>
 * Tenant and agent are mandatory. Channel and conversation are optional and
 * normalized to {@link #NONE}, meaning "global within tenant and agent".
 * Equality covers all four parts, so scopes built from identical fields are
 * interchangeable map keys.
 *
 * @param tenantId
 *            tenant the call is billed to
 * @param agentId
 *            bot persona whose model configuration applies
 * @param channel
 *            delivery channel, or {@link #NONE}
 * @param conversationId
 *            conversation within the channel, or {@link #NONE}
 */
public record IsolationScope(String tenantId, String agentId, String channel, String conversationId) {

    public static final String NONE = "none";

    private static final String SEPARATOR = ":";

    public IsolationScope {
        tenantId = requireId(tenantId, "tenantId");
        agentId = requireId(agentId, "agentId");
        channel = normalizeOptional(channel);
        conversationId = normalizeOptional(conversationId);
    }

    public static IsolationScope of(String tenantId, String agentId) {
        return new IsolationScope(tenantId, agentId, null, null);
    }

    public static IsolationScope of(String tenantId, String agentId, String channel, String conversationId) {
        return new IsolationScope(tenantId, agentId, channel, conversationId);
    }

    /**
     * Stable {@code tenant:agent} key used to index per-scope state.
     */
    public String scopeKey() {
        return tenantId + SEPARATOR + agentId;
    }

    /**
     * Full key including channel and conversation, for log correlation.
     */
    public String fullKey() {
        return scopeKey() + SEPARATOR + channel + SEPARATOR + conversationId;
    }

    public boolean isGlobal() {
        return NONE.equals(channel) && NONE.equals(conversationId);
    }

    @Override
    public String toString() {
        return fullKey();
    }

    private static String requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
        String trimmed = value.trim();
        if (trimmed.contains(SEPARATOR)) {
            throw new ValidationException(field + " must not contain '" + SEPARATOR + "': " + value);
        }
        return trimmed;
    }

    private static String normalizeOptional(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return value.trim();
    }
}
