package com.sailfish.retry.cancel;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read side of a cancellation signal. Retry loops observe it while waiting between attempts;
 * whoever created the context decides when it fires.
 *
 * @see CancelContext
 */
public interface CancellationContext {

    /**
     * @return true once the context has been cancelled, explicitly or by its deadline.
     */
    boolean isCancelled();

    /**
     * Blocks until the context is cancelled or the timeout elapses, whichever comes first.
     *
     * @param timeout Maximum time to wait. Zero or negative only checks the current state.
     * @return true if the context was cancelled when the wait ended.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException;

    /**
     * @return The instant at which this context cancels itself, if it has one.
     */
    Optional<Instant> deadline();

    /**
     * Registers a callback run once when the context is cancelled. Runs immediately on the
     * calling thread if the context is already cancelled.
     *
     * @param listener The callback.
     */
    void addListener(Runnable listener);

    /**
     * Unregisters a callback added with {@link #addListener(Runnable)}. No-op if it is unknown.
     *
     * @param listener The callback.
     */
    void removeListener(Runnable listener);

}
