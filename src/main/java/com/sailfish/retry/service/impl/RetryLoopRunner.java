package com.sailfish.retry.service.impl;

import com.sailfish.retry.Retries;
import com.sailfish.retry.RetryException;
import com.sailfish.retry.RetryTask;
import com.sailfish.retry.backoff.BackOff;
import com.sailfish.retry.cancel.CancellationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A Runnable driving one retry loop on an executor thread and reflecting its progress into
 * the loop's {@link TrackedRetryFuture}.
 */
class RetryLoopRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetryLoopRunner.class);

    private final TrackedRetryFuture future;
    private final CancellationContext context;
    private final BackOff backOff;
    private final RetryTask task;
    private final Consumer<TrackedRetryFuture> onFinished;

    RetryLoopRunner(TrackedRetryFuture future,
                    CancellationContext context,
                    BackOff backOff,
                    RetryTask task,
                    Consumer<TrackedRetryFuture> onFinished) {
        this.future = Objects.requireNonNull(future, "future cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.backOff = Objects.requireNonNull(backOff, "backOff cannot be null");
        this.task = Objects.requireNonNull(task, "task cannot be null");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished cannot be null");
    }

    @Override
    public void run() {
        String key = future.getKey();
        log.debug("Starting retry loop for key '{}' with {}", key, backOff);

        RetryException failure = null;
        try {
            Retries.until(context, backOff, this::attempt);
            log.debug("Retry loop for key '{}' succeeded on attempt {}", key, future.getAttempts());
        } catch (RetryException e) {
            failure = e;
            log.warn("Retry loop for key '{}' gave up: {}", key, e.getMessage());
        } catch (RuntimeException | Error e) {
            future.recordFailure(future.getAttempts(), e);
            log.error("Retry loop for key '{}' died unexpectedly: {}", key, e.getMessage(), e);
            throw e;
        } finally {
            // Reap before releasing waiters so awaitAll() never observes a finished entry
            future.finish(failure);
            onFinished.accept(future);
            future.release();
        }
    }

    /**
     * Completes the future of a loop that was dropped before it ever ran.
     */
    void abandon() {
        log.warn("Retry loop for key '{}' was dropped before its first attempt", future.getKey());
        future.finish(null);
        onFinished.accept(future);
        future.release();
    }

    private void attempt(CancellationContext ctx, int attempt) throws Exception {
        try {
            task.execute(ctx, attempt);
        } catch (Exception e) {
            future.recordFailure(attempt, e);
            throw e;
        } catch (Error e) {
            future.recordFailure(attempt, e);
            throw e;
        }
        future.recordSuccess(attempt);
    }
}
