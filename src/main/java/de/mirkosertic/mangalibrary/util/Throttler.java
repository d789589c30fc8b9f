package de.mirkosertic.mangalibrary.util;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs an action at most once per window, always running the most recently
 * scheduled one.
 * <p>
 * The first call after a quiet period runs inline on the calling thread. Calls
 * that arrive inside the window arm a single delayed execution for the rest of
 * the window; further calls only replace the action that this delayed execution
 * will run, they never re-arm it. The last call of a burst is therefore never
 * dropped.
 * <p>
 * Actions are run without holding the throttler's monitor.
 */
public class Throttler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Throttler.class);

    private final String name;
    private final long windowNanos;
    private final ScheduledExecutorService timer;

    private final Object monitor = new Object();

    private boolean executedOnce;
    private long lastExecutionNanos;
    private boolean pending;
    @Nullable
    private ScheduledFuture<?> pendingCall;
    @Nullable
    private Runnable latestAction;
    private boolean closed;

    public Throttler(final String name, final long windowMs) {
        if (windowMs < 0) {
            throw new IllegalArgumentException("Throttle window must not be negative: " + windowMs);
        }
        this.name = name;
        this.windowNanos = TimeUnit.MILLISECONDS.toNanos(windowMs);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, name + "-throttle");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Request execution of the given action, subject to the throttle window.
     *
     * @param action the action to run; replaces any action still waiting for a pending timer
     */
    public void schedule(final Runnable action) {
        final boolean runNow;
        synchronized (monitor) {
            if (closed) {
                logger.debug("Throttler {} is closed, ignoring scheduled call", name);
                return;
            }
            latestAction = action;

            final long now = System.nanoTime();
            final long elapsed = now - lastExecutionNanos;
            if (!pending && (!executedOnce || elapsed >= windowNanos)) {
                markExecuted(now);
                latestAction = null;
                runNow = true;
            } else {
                runNow = false;
                if (!pending) {
                    pending = true;
                    final long delay = windowNanos - elapsed;
                    pendingCall = timer.schedule(this::firePending, delay, TimeUnit.NANOSECONDS);
                    logger.debug("Throttler {} deferred call by {}ms", name, TimeUnit.NANOSECONDS.toMillis(delay));
                }
            }
        }

        if (runNow) {
            run(action);
        }
    }

    /**
     * Cancel the pending delayed execution, if any. The action that was waiting is dropped.
     *
     * @return true if a pending call was cancelled
     */
    public boolean cancelPending() {
        synchronized (monitor) {
            if (!pending) {
                return false;
            }
            if (pendingCall != null) {
                pendingCall.cancel(false);
            }
            pendingCall = null;
            pending = false;
            latestAction = null;
            logger.debug("Throttler {} cancelled pending call", name);
            return true;
        }
    }

    public boolean isPending() {
        synchronized (monitor) {
            return pending;
        }
    }

    private void firePending() {
        final Runnable action;
        synchronized (monitor) {
            if (!pending) {
                return;
            }
            pending = false;
            pendingCall = null;
            action = latestAction;
            latestAction = null;
            markExecuted(System.nanoTime());
        }

        if (action != null) {
            run(action);
        }
    }

    private void markExecuted(final long now) {
        executedOnce = true;
        lastExecutionNanos = now;
    }

    private void run(final Runnable action) {
        try {
            action.run();
        } catch (final RuntimeException e) {
            logger.error("Throttled action of {} failed", name, e);
        }
    }

    /**
     * Cancel any pending call and stop the timer thread. Later calls to
     * {@link #schedule(Runnable)} are ignored.
     */
    @Override
    public void close() {
        synchronized (monitor) {
            if (closed) {
                return;
            }
            closed = true;
        }
        cancelPending();
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Timer thread of throttler {} did not terminate in time", name);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
