package com.sailfish.retry.service;

import com.sailfish.retry.RetryTask;
import com.sailfish.retry.backoff.BackOff;
import com.sailfish.retry.cancel.CancellationContext;
import com.sailfish.retry.model.RetryFuture;

import java.util.List;

/**
 * Runs retry loops in the background, keyed by an identifier of the logical operation.
 * At most one loop runs per key at any time.
 */
public interface AsyncRetryRegistry {

    /**
     * Starts a retry loop for the key, or returns the loop already running for it.
     * <p>
     * When a loop for {@code key} is still retrying, its future is returned and the given
     * arguments are ignored. Otherwise a new loop is started on the registry's executor and its
     * future returned immediately, possibly before the first attempt has run.
     *
     * @param key Identifier of the logical operation.
     * @param context Cancellation signal for the loop.
     * @param backOff Backoff policy for the loop.
     * @param task The work to retry.
     * @return The handle of the running loop.
     * @throws IllegalArgumentException if key is blank.
     * @throws java.util.concurrent.RejectedExecutionException if the registry has been shut down.
     */
    RetryFuture async(String key, CancellationContext context, BackOff backOff, RetryTask task);

    /**
     * @return Number of loops currently tracked.
     */
    int size();

    /**
     * Takes a snapshot of the latest failure of every tracked loop that has failed at least once.
     *
     * @return An immutable list; later progress of the loops is not reflected.
     */
    List<Throwable> errors();

    /**
     * Blocks until every loop tracked at the time of the call has finished.
     * Loops registered while waiting are not waited for.
     *
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    void awaitAll() throws InterruptedException;

    /**
     * Initiates a graceful shutdown of the underlying executor service.
     * Loops still running after the timeout are interrupted, which ends them as cancelled.
     *
     * @param timeoutSeconds Time to wait for loops to complete before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);
}
