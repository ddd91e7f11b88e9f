package com.sailfish.retry.model;

import com.sailfish.retry.RetryException;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-only handle to a retry loop running in an
 * {@link com.sailfish.retry.service.AsyncRetryRegistry}.
 * Values change while the loop runs; none of them is final until {@link #isRetrying()} is false.
 */
public interface RetryFuture {

    /**
     * @return The key the loop was registered under.
     */
    String getKey();

    /**
     * @return The most recent failure of the task. Cleared when an attempt succeeds.
     */
    Optional<Throwable> getError();

    /**
     * @return true while the loop is still running.
     */
    boolean isRetrying();

    /**
     * @return Number of attempts made so far.
     */
    int getAttempts();

    /**
     * @return The terminal failure once the loop has given up; empty while running or after success.
     */
    Optional<RetryException> getFailure();

    /**
     * Blocks until the loop has finished.
     *
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    void await() throws InterruptedException;

    /**
     * Blocks until the loop has finished or the timeout elapses.
     *
     * @return true if the loop finished in time.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    boolean await(Duration timeout) throws InterruptedException;
}
