package me.golemcore.scheduler.domain.model;

import me.golemcore.scheduler.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class QuotaPolicyTest {

    @Test
    void shouldExposeDefaults() {
        QuotaPolicy policy = QuotaPolicy.defaults();

        assertEquals(1_000_000L, policy.getDailyTokenLimit());
        assertEquals(0, new BigDecimal("100.00").compareTo(policy.getMonthlyCostLimit()));
        assertEquals(10_000L, policy.getDailyRequestLimit());
        assertEquals(0.8, policy.getWarningThreshold());
        assertEquals(0.95, policy.getCriticalThreshold());
    }

    @Test
    void shouldTreatNonPositiveLimitsAsUnlimited() {
        QuotaPolicy policy = QuotaPolicy.builder()
                .dailyTokenLimit(0)
                .dailyRequestLimit(-1)
                .monthlyCostLimit(BigDecimal.ZERO)
                .build();

        assertFalse(policy.limitsTokens());
        assertFalse(policy.limitsRequests());
        assertFalse(policy.limitsCost());
    }

    @Test
    void shouldRejectCriticalBelowWarning() {
        QuotaPolicy policy = QuotaPolicy.builder()
                .warningThreshold(0.9)
                .criticalThreshold(0.5)
                .build();

        assertThrows(ValidationException.class, policy::validate);
    }

    @Test
    void shouldRejectThresholdAboveOne() {
        QuotaPolicy policy = QuotaPolicy.builder().warningThreshold(1.5).criticalThreshold(1.5).build();

        assertThrows(ValidationException.class, policy::validate);
    }

    @Test
    void shouldRejectMissingCostLimit() {
        QuotaPolicy policy = QuotaPolicy.builder().monthlyCostLimit(null).build();

        assertThrows(ValidationException.class, policy::validate);
    }

    @Test
    void shouldReturnSelfWhenValid() {
        QuotaPolicy policy = QuotaPolicy.defaults();

        assertSame(policy, policy.validate());
    }

    @Test
    void shouldOrderAlertLevels() {
        assertTrue(QuotaAlertLevel.CRITICAL.isAtLeast(QuotaAlertLevel.WARNING));
        assertFalse(QuotaAlertLevel.OK.isAtLeast(QuotaAlertLevel.WARNING));
        assertTrue(QuotaAlertLevel.WARNING.isAdvisory());
        assertFalse(QuotaAlertLevel.EXCEEDED.isAdvisory());
        assertEquals(QuotaAlertLevel.EXCEEDED, QuotaAlertLevel.max(QuotaAlertLevel.EXCEEDED, QuotaAlertLevel.OK));
    }
}
