package me.golemcore.scheduler.quota;

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

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Maps an instant to the accounting periods it belongs to. Pure: the same
 * instant and zone always yield the same period ids, so resets driven by a
 * comparison with the stored id are idempotent.
 */
final class QuotaPeriod {

    private QuotaPeriod() {
    }

    static LocalDate dayOf(Instant instant, ZoneId zone) {
        return LocalDate.ofInstant(instant, zone);
    }

    static YearMonth monthOf(Instant instant, ZoneId zone) {
        return YearMonth.from(dayOf(instant, zone));
    }

    static Instant startOfMonth(Instant instant, ZoneId zone) {
        return monthOf(instant, zone).atDay(1).atStartOfDay(zone).toInstant();
    }
}
