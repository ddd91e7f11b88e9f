package com.sailfish.retry;

import com.sailfish.retry.cancel.CancellationContext;

/**
 * A unit of work that can be retried.
 * Implementations should be idempotent, or take care of their own side effects between attempts.
 */
@FunctionalInterface
public interface RetryTask {

    /**
     * Executes one attempt of the work.
     *
     * @param context The cancellation context the retry loop was started with.
     * @param attempt The 1-based attempt number.
     * @throws Exception if the attempt fails. Throw {@link Retries#stop(Throwable)} to prevent further attempts.
     */
    void execute(CancellationContext context, int attempt) throws Exception;
}
