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

import java.util.Locale;

/**
 * Dispatch tier of a request. Higher ordinal is served first.
 */
public enum RequestPriority {

    LOW, NORMAL, HIGH, URGENT;

    /**
     * Returns the tier {@code steps} above this one, capped at {@link #URGENT}.
     */
    public RequestPriority promote(long steps) {
        if (steps <= 0) {
            return this;
        }
        long target = Math.min((long) ordinal() + steps, URGENT.ordinal());
        return values()[(int) target];
    }

    /**
     * Parses a case-insensitive tier name.
     *
     * @throws ValidationException
     *             when the value is blank or names no tier
     */
    public static RequestPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("priority must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown priority: " + value);
        }
    }
}
