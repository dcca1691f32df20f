package me.golemcore.scheduler.infrastructure.event;

import me.golemcore.scheduler.domain.exception.PersistenceDegradedException;
import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.domain.model.QuotaAlertLevel;
import me.golemcore.scheduler.domain.model.QuotaDimension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import static org.junit.jupiter.api.Assertions.*;

class QuotaAlertEventPublisherTest {

    private ApplicationEventPublisher applicationEventPublisher;
    private QuotaAlertEventPublisher publisher;

    @BeforeEach
    void setUp() {
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        publisher = new QuotaAlertEventPublisher(applicationEventPublisher);
    }

    @Test
    void shouldPublishQuotaAlertAsApplicationEvent() {
        QuotaAlert alert = QuotaAlert.builder()
                .tenantId("acme")
                .previousLevel(QuotaAlertLevel.OK)
                .level(QuotaAlertLevel.WARNING)
                .dimension(QuotaDimension.DAILY_TOKENS)
                .usageRatio(0.85)
                .currentUsage(850)
                .limit(1_000)
                .message("Token usage at 85%")
                .timestamp(Instant.parse("2026-03-15T12:00:00Z"))
                .build();

        publisher.onQuotaAlert(alert);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        QuotaAlertEvent event = assertInstanceOf(QuotaAlertEvent.class, captor.getValue());
        assertSame(alert, event.alert());
    }

    @Test
    void shouldPublishDegradedPersistenceEvent() {
        publisher.onPersistenceDegraded(new PersistenceDegradedException("acme", "disk full",
                new IOException("No space left on device")));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        UsagePersistenceDegradedEvent event = assertInstanceOf(UsagePersistenceDegradedEvent.class,
                captor.getValue());
        assertEquals("acme", event.tenantId());
        assertEquals("disk full", event.reason());
    }
}
