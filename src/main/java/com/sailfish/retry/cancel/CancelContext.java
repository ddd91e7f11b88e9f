package com.sailfish.retry.cancel;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation context bundled with the handle that cancels it, so an owner only has to keep
 * one object around for a long-running operation.
 * <p>
 * Contexts form a tree: a child created from a parent is cancelled whenever the parent is, and
 * inherits the parent's deadline if it is earlier than its own. Cancelling a child never affects
 * the parent.
 *
 * <pre>
 * {@code
 * CancelContext ctx = CancelContext.withTimeout(CancelContext.background(), Duration.ofSeconds(5));
 * try {
 *     Retries.until(ctx, BackOffs.interval(Duration.ofMillis(100)), (c, attempt) -> client.ping());
 * } finally {
 *     ctx.cancel();
 * }
 * }
 * </pre>
 */
public final class CancelContext implements CancellationContext {

    private static final Logger log = LoggerFactory.getLogger(CancelContext.class);

    private static final ScheduledExecutorService DEADLINE_SCHEDULER = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
            .setNameFormat("cancel-deadline-%d")
            .setDaemon(true)
            .build());

    private final CountDownLatch done = new CountDownLatch(1);
    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private final CancellationContext parent; // background() for roots
    private final Runnable parentHook = this::cancel;
    private final Instant deadline; // null when there is none

    private boolean cancelled; // guarded by lock
    private ScheduledFuture<?> deadlineTimer; // guarded by lock

    private CancelContext(CancellationContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * @return A context that is never cancelled.
     */
    public static CancellationContext background() {
        return Background.INSTANCE;
    }

    /**
     * Creates a cancellable child of the given context.
     *
     * @param parent The parent, or null for a root context.
     * @return The new context.
     */
    public static CancelContext create(CancellationContext parent) {
        CancellationContext effectiveParent = parent == null ? background() : parent;
        CancelContext child = new CancelContext(effectiveParent, effectiveParent.deadline().orElse(null));
        child.attach();
        return child;
    }

    /**
     * Creates a cancellable child that cancels itself once {@code timeout} has elapsed.
     */
    public static CancelContext withTimeout(CancellationContext parent, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return withDeadline(parent, Instant.now().plus(timeout));
    }

    /**
     * Creates a cancellable child that cancels itself at {@code deadline}, or at the parent's
     * deadline if that one comes first.
     */
    public static CancelContext withDeadline(CancellationContext parent, Instant deadline) {
        Objects.requireNonNull(deadline, "deadline cannot be null");
        CancellationContext effectiveParent = parent == null ? background() : parent;
        Instant effective = effectiveParent.deadline()
                .filter(parentDeadline -> parentDeadline.isBefore(deadline))
                .orElse(deadline);

        CancelContext child = new CancelContext(effectiveParent, effective);
        child.attach();
        child.scheduleDeadline();
        return child;
    }

    /**
     * Cancels this context and all of its descendants. Idempotent.
     */
    public void cancel() {
        List<Runnable> toNotify;
        ScheduledFuture<?> timer;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
            timer = deadlineTimer;
            deadlineTimer = null;
        }
        done.countDown();

        if (timer != null) {
            timer.cancel(false);
        }
        parent.removeListener(parentHook);

        for (Runnable listener : toNotify) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    @Override
    public boolean isCancelled() {
        return done.getCount() == 0;
    }

    @Override
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    @Override
    public void addListener(Runnable listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    @Override
    public void removeListener(Runnable listener) {
        synchronized (lock) {
            listeners.remove(listener);
        }
    }

    private void attach() {
        parent.addListener(parentHook);
    }

    private void scheduleDeadline() {
        long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
        if (delayNanos <= 0) {
            log.debug("Deadline {} already passed, cancelling immediately", deadline);
            cancel();
            return;
        }
        ScheduledFuture<?> timer = DEADLINE_SCHEDULER.schedule(this::cancel, delayNanos, TimeUnit.NANOSECONDS);
        synchronized (lock) {
            if (!cancelled) {
                deadlineTimer = timer;
                return;
            }
        }
        timer.cancel(false);
    }

    @Override
    public String toString() {
        return "CancelContext{cancelled=" + isCancelled() + ", deadline=" + deadline + '}';
    }

    private enum Background implements CancellationContext {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public boolean awaitCancellation(Duration timeout) throws InterruptedException {
            long nanos = timeout.toNanos();
            if (nanos > 0) {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
            return false;
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.empty();
        }

        @Override
        public void addListener(Runnable listener) {
            // never fires
        }

        @Override
        public void removeListener(Runnable listener) {
        }

        @Override
        public String toString() {
            return "CancelContext.background()";
        }
    }
}
