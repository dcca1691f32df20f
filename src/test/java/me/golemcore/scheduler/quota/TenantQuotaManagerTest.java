package me.golemcore.scheduler.quota;

import me.golemcore.scheduler.domain.exception.PersistenceDegradedException;
import me.golemcore.scheduler.domain.exception.ValidationException;
import me.golemcore.scheduler.domain.model.AgentUsage;
import me.golemcore.scheduler.domain.model.QuotaAlert;
import me.golemcore.scheduler.domain.model.QuotaAlertLevel;
import me.golemcore.scheduler.domain.model.QuotaCheck;
import me.golemcore.scheduler.domain.model.QuotaDimension;
import me.golemcore.scheduler.domain.model.QuotaPolicy;
import me.golemcore.scheduler.domain.model.UsageDelta;
import me.golemcore.scheduler.domain.model.UsageStats;
import me.golemcore.scheduler.port.outbound.QuotaAlertListener;
import me.golemcore.scheduler.port.outbound.UsagePersistencePort;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class TenantQuotaManagerTest {

    private static final String TENANT = "acme";
    private static final String AGENT = "support";
    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private MutableClock clock;
    private UsagePersistencePort persistencePort;
    private UsagePersistenceDispatcher dispatcher;
    private QuotaAlertListener listener;
    private TenantQuotaManager quotaManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        persistencePort = mock(UsagePersistencePort.class);
        dispatcher = mock(UsagePersistenceDispatcher.class);
        when(dispatcher.persist(any())).thenReturn(Mono.empty());
        listener = mock(QuotaAlertListener.class);

        quotaManager = new TenantQuotaManager(persistencePort, dispatcher, clock, QuotaPolicy.defaults(), 100,
                false);
        quotaManager.addAlertListener(listener);
    }

    private void tokenLimit(long limit) {
        quotaManager.setPolicy(TENANT, QuotaPolicy.builder().dailyTokenLimit(limit).build());
    }

    // ===== Admission =====

    @Test
    void shouldRejectAdmissionWhenProjectedTokensExceedLimit() {
        tokenLimit(1000);
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 950, BigDecimal.ZERO);

        QuotaCheck check = quotaManager.evaluateAdmission(TENANT, 100);

        assertEquals(QuotaAlertLevel.EXCEEDED, check.getLevel());
        assertEquals(QuotaDimension.DAILY_TOKENS, check.getDimension());
        assertTrue(check.isExceeded());
        assertEquals(QuotaAlertLevel.EXCEEDED, quotaManager.checkAdmission(TENANT, 100));
    }

    @Test
    void shouldAdmitWhenProjectionLandsExactlyOnLimit() {
        tokenLimit(1000);
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 950, BigDecimal.ZERO);

        QuotaCheck check = quotaManager.evaluateAdmission(TENANT, 50);

        assertEquals(QuotaAlertLevel.CRITICAL, check.getLevel());
    }

    @Test
    void shouldReportOkForUnknownTenant() {
        assertEquals(QuotaAlertLevel.OK, quotaManager.checkAdmission("fresh", 10));
    }

    @Test
    void shouldRejectAdmissionWhenRequestCountWouldExceedLimit() {
        quotaManager.setPolicy(TENANT, QuotaPolicy.builder().dailyRequestLimit(2).build());
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 1, BigDecimal.ZERO);
        quotaManager.recordUsage(TENANT, AGENT, "r-2", 1, BigDecimal.ZERO);

        QuotaCheck check = quotaManager.evaluateAdmission(TENANT, 0);

        assertEquals(QuotaAlertLevel.EXCEEDED, check.getLevel());
        assertEquals(QuotaDimension.DAILY_REQUESTS, check.getDimension());
    }

    @Test
    void shouldRejectAdmissionOnceMonthlyCostIsSpent() {
        quotaManager.setPolicy(TENANT, QuotaPolicy.builder().monthlyCostLimit(new BigDecimal("1.00")).build());
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 10, new BigDecimal("1.00"));

        QuotaCheck check = quotaManager.evaluateAdmission(TENANT, 0);

        assertEquals(QuotaAlertLevel.EXCEEDED, check.getLevel());
        assertEquals(QuotaDimension.MONTHLY_COST, check.getDimension());
    }

    @Test
    void shouldIgnoreUnlimitedDimensions() {
        quotaManager.setPolicy(TENANT, QuotaPolicy.builder()
                .dailyTokenLimit(0)
                .dailyRequestLimit(0)
                .monthlyCostLimit(BigDecimal.ZERO)
                .build());
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 5_000_000, new BigDecimal("500"));

        assertEquals(QuotaAlertLevel.OK, quotaManager.checkAdmission(TENANT, 1_000_000));
    }

    @Test
    void shouldRejectBlankTenant() {
        assertThrows(ValidationException.class, () -> quotaManager.evaluateAdmission(" ", 1));
        assertThrows(ValidationException.class, () -> quotaManager.recordUsage(null, AGENT, 1, BigDecimal.ZERO));
    }

    // ===== Recording =====

    @Test
    void shouldKeepTenantTotalsEqualToSumOfAgents() {
        quotaManager.recordUsage(TENANT, "a1", "r-1", 100, new BigDecimal("0.10"));
        quotaManager.recordUsage(TENANT, "a2", "r-2", 250, new BigDecimal("0.25"));
        quotaManager.recordUsage(TENANT, "a1", "r-3", 50, new BigDecimal("0.05"));
        quotaManager.recordUsage(TENANT, null, "r-4", 5, BigDecimal.ZERO);

        UsageStats stats = quotaManager.getUsage(TENANT);

        assertEquals(405, stats.getTokensUsedToday());
        assertEquals(4, stats.getRequestsToday());
        assertEquals(0, new BigDecimal("0.40").compareTo(stats.getCostIncurredThisMonth()));
        long agentTokens = stats.getAgentUsage().values().stream().mapToLong(AgentUsage::getTokensUsedToday).sum();
        long agentRequests = stats.getAgentUsage().values().stream().mapToLong(AgentUsage::getRequestsToday).sum();
        assertEquals(stats.getTokensUsedToday(), agentTokens);
        assertEquals(stats.getRequestsToday(), agentRequests);
        assertEquals(150, stats.getAgentUsage().get("a1").getTokensUsedToday());
        assertTrue(stats.getAgentUsage().containsKey("unknown"));
    }

    @Test
    void shouldClampNegativeTokensAndCost() {
        quotaManager.recordUsage(TENANT, AGENT, "r-1", -10, new BigDecimal("-1"));

        UsageStats stats = quotaManager.getUsage(TENANT);

        assertEquals(0, stats.getTokensUsedToday());
        assertEquals(1, stats.getRequestsToday());
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getCostIncurredThisMonth()));
    }

    @Test
    void shouldPersistEachRecordedDelta() {
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 120, new BigDecimal("0.02"));

        ArgumentCaptor<UsageDelta> captor = ArgumentCaptor.forClass(UsageDelta.class);
        verify(dispatcher).persist(captor.capture());
        UsageDelta delta = captor.getValue();
        assertEquals(TENANT, delta.getTenantId());
        assertEquals(AGENT, delta.getAgentId());
        assertEquals("r-1", delta.getRequestId());
        assertEquals(120, delta.getTokens());
        assertEquals(NOW, delta.getTimestamp());
    }

    @Test
    void shouldNotLoseUpdatesUnderConcurrentRecording() throws InterruptedException {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            String agent = "agent-" + (t % 3);
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    quotaManager.recordUsage(TENANT, agent, 3, new BigDecimal("0.001"));
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        UsageStats stats = quotaManager.getUsage(TENANT);
        assertEquals(threads * perThread * 3L, stats.getTokensUsedToday());
        assertEquals(threads * perThread, stats.getRequestsToday());
        assertEquals(0, new BigDecimal("4.000").compareTo(stats.getCostIncurredThisMonth()));
    }

    // ===== Period resets =====

    @Test
    void shouldResetDailyCountersButKeepMonthlyCost() {
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 500, new BigDecimal("2.50"));

        clock.advance(Duration.ofDays(1));
        UsageStats stats = quotaManager.getUsage(TENANT);

        assertEquals(0, stats.getTokensUsedToday());
        assertEquals(0, stats.getRequestsToday());
        assertEquals(0, new BigDecimal("2.50").compareTo(stats.getCostIncurredThisMonth()));
        assertEquals(NOW.plus(Duration.ofDays(1)).atZone(clock.getZone()).toLocalDate(), stats.getDay());
    }

    @Test
    void shouldApplyDailyResetOnlyOnce() {
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 500, BigDecimal.ZERO);
        clock.advance(Duration.ofDays(1));

        quotaManager.recordUsage(TENANT, AGENT, "r-2", 10, BigDecimal.ZERO);
        Instant firstReset = quotaManager.getUsage(TENANT).getLastDailyReset();
        clock.advance(Duration.ofMinutes(5));
        quotaManager.recordUsage(TENANT, AGENT, "r-3", 10, BigDecimal.ZERO);

        UsageStats stats = quotaManager.getUsage(TENANT);
        assertEquals(20, stats.getTokensUsedToday());
        assertEquals(2, stats.getRequestsToday());
        assertEquals(firstReset, stats.getLastDailyReset());
    }

    @Test
    void shouldResetMonthlyCostAtMonthBoundary() {
        clock.setInstant(Instant.parse("2026-01-31T23:30:00Z"));
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 10, new BigDecimal("7.00"));

        clock.setInstant(Instant.parse("2026-02-01T00:10:00Z"));
        quotaManager.recordUsage(TENANT, AGENT, "r-2", 10, new BigDecimal("1.00"));

        UsageStats stats = quotaManager.getUsage(TENANT);
        assertEquals(0, new BigDecimal("1.00").compareTo(stats.getCostIncurredThisMonth()));
        assertEquals(Instant.parse("2026-02-01T00:10:00Z"), stats.getLastMonthlyReset());
    }

    // ===== Policies =====

    @Test
    void shouldReturnDefaultPolicyForUnconfiguredTenant() {
        assertEquals(QuotaPolicy.defaults(), quotaManager.getPolicy("other"));
    }

    @Test
    void shouldKeepCountersWhenPolicyChanges() {
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 500, BigDecimal.ZERO);

        quotaManager.setPolicy(TENANT, QuotaPolicy.builder().dailyTokenLimit(600).build());

        UsageStats stats = quotaManager.getUsage(TENANT);
        assertEquals(500, stats.getTokensUsedToday());
        assertEquals(QuotaAlertLevel.WARNING, stats.getAlertLevel());
    }

    @Test
    void shouldRejectInvalidPolicy() {
        QuotaPolicy invalid = QuotaPolicy.builder().warningThreshold(0.9).criticalThreshold(0.1).build();

        assertThrows(ValidationException.class, () -> quotaManager.setPolicy(TENANT, invalid));
        assertThrows(ValidationException.class, () -> quotaManager.setPolicy(TENANT, null));
    }

    // ===== Alerts =====

    @Test
    void shouldNotifyOnlyWhenLevelRises() {
        tokenLimit(1000);

        quotaManager.recordUsage(TENANT, AGENT, "r-1", 500, BigDecimal.ZERO);
        quotaManager.recordUsage(TENANT, AGENT, "r-2", 300, BigDecimal.ZERO);
        quotaManager.recordUsage(TENANT, AGENT, "r-3", 50, BigDecimal.ZERO);
        quotaManager.recordUsage(TENANT, AGENT, "r-4", 100, BigDecimal.ZERO);

        ArgumentCaptor<QuotaAlert> captor = ArgumentCaptor.forClass(QuotaAlert.class);
        verify(listener, times(2)).onQuotaAlert(captor.capture());
        List<QuotaAlert> alerts = captor.getAllValues();
        assertEquals(QuotaAlertLevel.WARNING, alerts.get(0).getLevel());
        assertEquals(QuotaAlertLevel.OK, alerts.get(0).getPreviousLevel());
        assertEquals(QuotaAlertLevel.CRITICAL, alerts.get(1).getLevel());
        assertEquals(QuotaDimension.DAILY_TOKENS, alerts.get(1).getDimension());
        assertEquals(2, quotaManager.getRecentAlerts(TENANT, Duration.ofHours(1)).size());
    }

    @Test
    void shouldNotifyAgainAfterDailyReset() {
        tokenLimit(1000);
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 850, BigDecimal.ZERO);

        clock.advance(Duration.ofDays(1));
        quotaManager.recordUsage(TENANT, AGENT, "r-2", 850, BigDecimal.ZERO);

        verify(listener, times(2)).onQuotaAlert(any());
    }

    @Test
    void shouldEmitExceededWhenRecordedUsageReachesLimit() {
        tokenLimit(1000);

        quotaManager.recordUsage(TENANT, AGENT, "r-1", 1000, BigDecimal.ZERO);

        ArgumentCaptor<QuotaAlert> captor = ArgumentCaptor.forClass(QuotaAlert.class);
        verify(listener).onQuotaAlert(captor.capture());
        assertEquals(QuotaAlertLevel.EXCEEDED, captor.getValue().getLevel());
    }

    @Test
    void shouldNotifyAdvisoryLevelFromAdmission() {
        tokenLimit(1000);
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 700, BigDecimal.ZERO);

        QuotaCheck check = quotaManager.evaluateAdmission(TENANT, 200);
        quotaManager.notifyAdvisory(TENANT, check);
        quotaManager.notifyAdvisory(TENANT, check);

        assertEquals(QuotaAlertLevel.WARNING, check.getLevel());
        verify(listener, times(1)).onQuotaAlert(any());
    }

    @Test
    void shouldFilterRecentAlertsByTenantAndWindow() {
        tokenLimit(100);
        quotaManager.setPolicy("other", QuotaPolicy.builder().dailyTokenLimit(100).build());
        quotaManager.recordUsage(TENANT, AGENT, "r-1", 90, BigDecimal.ZERO);
        clock.advance(Duration.ofMinutes(30));
        quotaManager.recordUsage("other", AGENT, "r-2", 90, BigDecimal.ZERO);

        assertEquals(2, quotaManager.getRecentAlerts(null, Duration.ofHours(1)).size());
        assertEquals(1, quotaManager.getRecentAlerts(TENANT, Duration.ofHours(1)).size());
        assertEquals(0, quotaManager.getRecentAlerts(TENANT, Duration.ofMinutes(10)).size());
    }

    @Test
    void shouldTrimAlertHistory() {
        quotaManager = new TenantQuotaManager(persistencePort, dispatcher, clock, QuotaPolicy.defaults(), 4, false);
        for (int i = 0; i < 5; i++) {
            String tenant = "t" + i;
            quotaManager.setPolicy(tenant, QuotaPolicy.builder().dailyTokenLimit(10).build());
            quotaManager.recordUsage(tenant, AGENT, 10, BigDecimal.ZERO);
        }

        assertEquals(2, quotaManager.getRecentAlerts(null, Duration.ofDays(1)).size());
    }

    @Test
    void shouldSurviveFailingListener() {
        QuotaAlertListener failing = mock(QuotaAlertListener.class);
        doThrow(new IllegalStateException("listener down")).when(failing).onQuotaAlert(any());
        quotaManager.removeAlertListener(listener);
        quotaManager.addAlertListener(failing);
        quotaManager.addAlertListener(listener);
        tokenLimit(100);

        assertDoesNotThrow(() -> quotaManager.recordUsage(TENANT, AGENT, "r-1", 90, BigDecimal.ZERO));
        verify(listener).onQuotaAlert(any());
    }

    // ===== Persistence =====

    @Test
    void shouldKeepCountingAndNotifyWhenPersistenceDegrades() throws InterruptedException {
        UsagePersistencePort failingPort = mock(UsagePersistencePort.class);
        when(failingPort.persistUsageDelta(any()))
                .thenAnswer(invocation -> CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        UsagePersistenceDispatcher realDispatcher = new UsagePersistenceDispatcher(failingPort, 1,
                Duration.ofMillis(1));
        CountDownLatch degradedLatch = new CountDownLatch(1);
        quotaManager = new TenantQuotaManager(failingPort, realDispatcher, clock, QuotaPolicy.defaults(), 100,
                false);
        quotaManager.addAlertListener(new QuotaAlertListener() {
            @Override
            public void onQuotaAlert(QuotaAlert alert) {
            }

            @Override
            public void onPersistenceDegraded(PersistenceDegradedException error) {
                degradedLatch.countDown();
            }
        });

        quotaManager.recordUsage(TENANT, AGENT, "r-1", 42, BigDecimal.ZERO);

        assertTrue(degradedLatch.await(5, TimeUnit.SECONDS));
        assertTrue(quotaManager.isPersistenceDegraded());
        assertEquals(42, quotaManager.getUsage(TENANT).getTokensUsedToday());
    }

    @Test
    void shouldRestoreCurrentMonthFromPersistence() {
        when(persistencePort.loadUsageSince(any())).thenReturn(List.of(
                delta(TENANT, "a1", 900, "0.50", NOW.minus(Duration.ofHours(1))),
                delta(TENANT, "a2", 300, "1.25", Instant.parse("2026-03-02T08:00:00Z")),
                delta(TENANT, "a1", 999, "9.00", Instant.parse("2026-02-27T08:00:00Z"))));
        tokenLimit(1000);

        quotaManager.restoreFromPersistence();

        UsageStats stats = quotaManager.getUsage(TENANT);
        assertEquals(900, stats.getTokensUsedToday());
        assertEquals(1, stats.getRequestsToday());
        assertEquals(0, new BigDecimal("1.75").compareTo(stats.getCostIncurredThisMonth()));
        verify(listener, never()).onQuotaAlert(any());
        verify(dispatcher, never()).persist(any());
    }

    @Test
    void shouldNotRepeatAlertLevelReachedBeforeRestart() {
        when(persistencePort.loadUsageSince(any())).thenReturn(List.of(
                delta(TENANT, AGENT, 900, "0", NOW.minus(Duration.ofMinutes(5)))));
        tokenLimit(1000);
        quotaManager.restoreFromPersistence();

        quotaManager.recordUsage(TENANT, AGENT, "r-1", 10, BigDecimal.ZERO);
        verify(listener, never()).onQuotaAlert(any());

        quotaManager.recordUsage(TENANT, AGENT, "r-2", 50, BigDecimal.ZERO);
        ArgumentCaptor<QuotaAlert> captor = ArgumentCaptor.forClass(QuotaAlert.class);
        verify(listener).onQuotaAlert(captor.capture());
        assertEquals(QuotaAlertLevel.CRITICAL, captor.getValue().getLevel());
    }

    @Test
    void shouldStartEmptyWhenRestoreFails() {
        when(persistencePort.loadUsageSince(any())).thenThrow(new IllegalStateException("unreadable"));

        assertDoesNotThrow(() -> quotaManager.restoreFromPersistence());
        assertEquals(0, quotaManager.getUsage(TENANT).getTokensUsedToday());
    }

    private static UsageDelta delta(String tenant, String agent, long tokens, String cost, Instant at) {
        return UsageDelta.builder()
                .tenantId(tenant)
                .agentId(agent)
                .requestId("restored")
                .tokens(tokens)
                .cost(new BigDecimal(cost))
                .timestamp(at)
                .build();
    }
}
