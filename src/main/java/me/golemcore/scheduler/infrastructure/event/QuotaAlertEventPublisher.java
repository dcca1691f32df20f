package me.golemcore.scheduler.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.exception.PersistenceDegradedException;
import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.port.outbound.QuotaAlertListener;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes quota alerts as Spring application events so any
 * {@code @EventListener} can react without registering with the quota manager.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuotaAlertEventPublisher implements QuotaAlertListener {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onQuotaAlert(QuotaAlert alert) {
        log.info("[Quota] {} -> {} for tenant {} ({}, {}%)", alert.getPreviousLevel(), alert.getLevel(),
                alert.getTenantId(), alert.getDimension(), Math.round(alert.getUsageRatio() * 100));
        eventPublisher.publishEvent(new QuotaAlertEvent(alert));
    }

    @Override
    public void onPersistenceDegraded(PersistenceDegradedException exception) {
        log.warn("[Usage] Persistence degraded for tenant {}: {}", exception.getTenantId(), exception.getMessage());
        eventPublisher.publishEvent(new UsagePersistenceDegradedEvent(exception.getTenantId(), exception.getMessage()));
    }
}
