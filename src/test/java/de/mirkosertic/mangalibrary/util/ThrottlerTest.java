package de.mirkosertic.mangalibrary.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Throttler Tests")
class ThrottlerTest {

    private Throttler throttler;

    @AfterEach
    void tearDown() {
        if (throttler != null) {
            throttler.close();
        }
    }

    @Test
    @DisplayName("Should run the first call inline on the calling thread")
    void shouldRunFirstCallInline() {
        throttler = new Throttler("test", 500);
        final AtomicReference<Thread> executingThread = new AtomicReference<>();

        throttler.schedule(() -> executingThread.set(Thread.currentThread()));

        assertThat(executingThread.get()).isSameAs(Thread.currentThread());
        assertThat(throttler.isPending()).isFalse();
    }

    @Test
    @DisplayName("Should coalesce a burst into one trailing call that runs the latest action")
    void shouldCoalesceBurstIntoLatestAction() {
        throttler = new Throttler("test", 500);
        final Runnable[] actions = new Runnable[100];
        for (int i = 0; i < actions.length; i++) {
            actions[i] = mock(Runnable.class);
        }

        // Fire 100 calls within one window
        for (final Runnable action : actions) {
            throttler.schedule(action);
        }

        // First call ran inline, the last one runs once the window has elapsed
        verify(actions[0], times(1)).run();
        verify(actions[99], timeout(2000).times(1)).run();
        for (int i = 1; i < 99; i++) {
            verify(actions[i], never()).run();
        }

        // Nothing else runs afterwards
        verify(actions[99], after(700).times(1)).run();
        assertThat(throttler.isPending()).isFalse();
    }

    @Test
    @DisplayName("Should not re-arm the pending timer when further calls arrive")
    void shouldNotRearmPendingTimer() throws Exception {
        throttler = new Throttler("test", 1000);
        final AtomicLong firedAt = new AtomicLong();
        final CountDownLatch fired = new CountDownLatch(1);

        final long start = System.nanoTime();
        throttler.schedule(() -> {
        });
        throttler.schedule(() -> {
        });
        Thread.sleep(500);
        throttler.schedule(() -> {
            firedAt.set(System.nanoTime());
            fired.countDown();
        });

        assertThat(fired.await(3, TimeUnit.SECONDS)).isTrue();
        final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(firedAt.get() - start);
        // A re-armed timer would fire about 1500ms after start
        assertThat(elapsedMs).isBetween(900L, 1400L);
    }

    @Test
    @DisplayName("Should run immediately again once the window has elapsed")
    void shouldRunImmediatelyAfterWindow() throws Exception {
        throttler = new Throttler("test", 100);
        final Runnable first = mock(Runnable.class);
        final Runnable second = mock(Runnable.class);

        throttler.schedule(first);
        Thread.sleep(250);
        throttler.schedule(second);

        verify(first, times(1)).run();
        verify(second, times(1)).run();
        assertThat(throttler.isPending()).isFalse();
    }

    @Test
    @DisplayName("Should drop the pending call when cancelled")
    void shouldDropCancelledCall() {
        throttler = new Throttler("test", 300);
        final Runnable first = mock(Runnable.class);
        final Runnable pending = mock(Runnable.class);

        throttler.schedule(first);
        throttler.schedule(pending);

        assertThat(throttler.isPending()).isTrue();
        assertThat(throttler.cancelPending()).isTrue();
        assertThat(throttler.cancelPending()).isFalse();

        verify(pending, after(600).never()).run();
    }

    @Test
    @DisplayName("Should keep working after an action throws")
    void shouldSurviveFailingAction() {
        throttler = new Throttler("test", 200);
        final Runnable failing = mock(Runnable.class);
        doThrow(new IllegalStateException("boom")).when(failing).run();
        final Runnable next = mock(Runnable.class);

        throttler.schedule(failing);
        throttler.schedule(next);

        verify(failing, times(1)).run();
        verify(next, timeout(2000).times(1)).run();
    }

    @Test
    @DisplayName("Should ignore calls and cancel the timer after close")
    void shouldIgnoreCallsAfterClose() {
        throttler = new Throttler("test", 300);
        final Runnable first = mock(Runnable.class);
        final Runnable pending = mock(Runnable.class);
        final Runnable late = mock(Runnable.class);

        throttler.schedule(first);
        throttler.schedule(pending);
        throttler.close();
        throttler.schedule(late);

        verify(pending, after(600).never()).run();
        verify(late, never()).run();
    }
}
