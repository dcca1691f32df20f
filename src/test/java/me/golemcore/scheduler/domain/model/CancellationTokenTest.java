package me.golemcore.scheduler.domain.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void shouldRunCallbacksOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunLateCallbackImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldContinueAfterFailingCallback() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertEquals(1, calls.get());
    }
}
