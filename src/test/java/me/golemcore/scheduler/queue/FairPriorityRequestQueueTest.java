package me.golemcore.scheduler.queue;

import me.golemcore.scheduler.domain.exception.QueueFullException;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelPayload;
import me.golemcore.scheduler.domain.model.QueueStats;
import me.golemcore.scheduler.domain.model.RequestPriority;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class FairPriorityRequestQueueTest {

    private static final IsolationScope SCOPE_A = IsolationScope.of("acme", "a");
    private static final IsolationScope SCOPE_B = IsolationScope.of("acme", "b");
    private static final IsolationScope SCOPE_C = IsolationScope.of("globex", "c");

    private MutableClock clock;
    private FairPriorityRequestQueue queue;
    private final AtomicLong sequence = new AtomicLong();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        queue = new FairPriorityRequestQueue(clock, 100, 10, Duration.ofSeconds(30));
    }

    private RequestDescriptor descriptor(String id, IsolationScope scope, RequestPriority priority) {
        return new RequestDescriptor(id, scope, priority, ModelPayload.ofUserText("hi"), 10, null,
                clock.instant(), clock.instant().plus(Duration.ofMinutes(5)), sequence.incrementAndGet());
    }

    private List<String> drain() throws InterruptedException {
        List<String> ids = new ArrayList<>();
        RequestDescriptor next;
        while ((next = queue.poll(Duration.ZERO)) != null) {
            ids.add(next.getRequestId());
        }
        return ids;
    }

    // ===== Ordering =====

    @Test
    void shouldDispatchUrgentBeforeEarlierNormal() throws InterruptedException {
        queue.offer(descriptor("n1", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("n2", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("n3", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("u1", SCOPE_A, RequestPriority.URGENT));

        assertEquals(List.of("u1", "n1", "n2", "n3"), drain());
    }

    @Test
    void shouldServeTiersStrictlyInOrder() throws InterruptedException {
        queue.offer(descriptor("low", SCOPE_A, RequestPriority.LOW));
        queue.offer(descriptor("normal", SCOPE_B, RequestPriority.NORMAL));
        queue.offer(descriptor("high", SCOPE_C, RequestPriority.HIGH));
        queue.offer(descriptor("urgent", SCOPE_A, RequestPriority.URGENT));

        assertEquals(List.of("urgent", "high", "normal", "low"), drain());
    }

    @Test
    void shouldRotateAcrossScopesWithinTier() throws InterruptedException {
        queue.offer(descriptor("a1", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("a2", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("a3", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("b1", SCOPE_B, RequestPriority.NORMAL));
        queue.offer(descriptor("c1", SCOPE_C, RequestPriority.NORMAL));
        queue.offer(descriptor("b2", SCOPE_B, RequestPriority.NORMAL));

        assertEquals(List.of("a1", "b1", "c1", "a2", "b2", "a3"), drain());
    }

    @Test
    void shouldKeepSubmissionOrderWhenRequeued() throws InterruptedException {
        RequestDescriptor first = descriptor("first", SCOPE_A, RequestPriority.NORMAL);
        RequestDescriptor second = descriptor("second", SCOPE_A, RequestPriority.NORMAL);
        queue.offer(second);
        queue.offer(first);

        assertEquals(List.of("first", "second"), drain());
    }

    // ===== Aging =====

    @Test
    void shouldPromoteLongWaitingLowPriorityRequest() throws InterruptedException {
        queue.offer(descriptor("old-low", SCOPE_A, RequestPriority.LOW));
        clock.advance(Duration.ofSeconds(61));
        queue.offer(descriptor("fresh-normal", SCOPE_B, RequestPriority.NORMAL));

        assertEquals("old-low", queue.poll(Duration.ZERO).getRequestId());
        assertEquals(1, queue.getStats().getPromoted());
    }

    @Test
    void shouldNotPromoteBeforeAgingInterval() throws InterruptedException {
        queue.offer(descriptor("low", SCOPE_A, RequestPriority.LOW));
        clock.advance(Duration.ofSeconds(29));
        queue.offer(descriptor("normal", SCOPE_B, RequestPriority.NORMAL));

        assertEquals(List.of("normal", "low"), drain());
    }

    @Test
    void shouldCapPromotionAtUrgent() throws InterruptedException {
        queue.offer(descriptor("low", SCOPE_A, RequestPriority.LOW));
        clock.advance(Duration.ofHours(1));

        queue.poll(Duration.ZERO);

        assertEquals(1, queue.getStats().getPromoted());
    }

    // ===== Capacity =====

    @Test
    void shouldRejectWhenScopeIsFull() {
        queue = new FairPriorityRequestQueue(clock, 100, 2, Duration.ofSeconds(30));
        queue.offer(descriptor("a1", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("a2", SCOPE_A, RequestPriority.NORMAL));

        QueueFullException error = assertThrows(QueueFullException.class,
                () -> queue.offer(descriptor("a3", SCOPE_A, RequestPriority.NORMAL)));

        assertEquals("acme:a", error.getScopeKey());
        assertDoesNotThrow(() -> queue.offer(descriptor("b1", SCOPE_B, RequestPriority.NORMAL)));
        assertEquals(3, queue.size());
        assertEquals(1, queue.getStats().getRejected());
    }

    @Test
    void shouldRejectWhenQueueIsFull() {
        queue = new FairPriorityRequestQueue(clock, 2, 10, Duration.ofSeconds(30));
        queue.offer(descriptor("a1", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("b1", SCOPE_B, RequestPriority.NORMAL));

        assertThrows(QueueFullException.class, () -> queue.offer(descriptor("c1", SCOPE_C, RequestPriority.URGENT)));
    }

    @Test
    void shouldIgnoreDuplicateOffer() {
        RequestDescriptor request = descriptor("a1", SCOPE_A, RequestPriority.NORMAL);
        queue.offer(request);
        queue.offer(request);

        assertEquals(1, queue.size());
    }

    // ===== Removal and stats =====

    @Test
    void shouldRemoveQueuedRequest() throws InterruptedException {
        RequestDescriptor a1 = descriptor("a1", SCOPE_A, RequestPriority.NORMAL);
        queue.offer(a1);
        queue.offer(descriptor("b1", SCOPE_B, RequestPriority.NORMAL));

        assertTrue(queue.remove(a1));
        assertFalse(queue.remove(a1));

        assertEquals(0, queue.sizeOf(SCOPE_A));
        assertEquals(List.of("b1"), drain());
    }

    @Test
    void shouldReportStats() throws InterruptedException {
        queue.offer(descriptor("a1", SCOPE_A, RequestPriority.NORMAL));
        queue.offer(descriptor("a2", SCOPE_A, RequestPriority.HIGH));
        queue.offer(descriptor("b1", SCOPE_B, RequestPriority.LOW));
        queue.poll(Duration.ZERO);

        QueueStats stats = queue.getStats();
        assertEquals(2, stats.getSize());
        assertEquals(2, stats.getActiveScopes());
        assertEquals(3, stats.getOffered());
        assertEquals(1, stats.getDispatched());
        assertEquals(0, stats.getSizeByTier().get(RequestPriority.HIGH));
        assertEquals(1, stats.getSizeByTier().get(RequestPriority.LOW));
        assertEquals(1, queue.sizeOf(SCOPE_A));
    }

    // ===== Blocking =====

    @Test
    void shouldReturnNullWhenPollTimesOut() throws InterruptedException {
        assertNull(queue.poll(Duration.ofMillis(20)));
    }

    @Test
    void shouldWakeWaitingPollerOnOffer() throws Exception {
        CompletableFuture<RequestDescriptor> polled = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.poll(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        Thread.sleep(50);

        queue.offer(descriptor("a1", SCOPE_A, RequestPriority.NORMAL));

        assertEquals("a1", polled.get(5, TimeUnit.SECONDS).getRequestId());
    }
}
