package com.sailfish.retry.service.impl;

import com.sailfish.retry.RetryException;
import com.sailfish.retry.model.RetryFuture;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Mutable side of a {@link RetryFuture}, written only by the thread running the loop.
 * Fields are volatile so readers holding the handle always see a consistent latest value.
 */
class TrackedRetryFuture implements RetryFuture {

    private final String key;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile int attempts;
    private volatile Throwable error;
    private volatile RetryException failure;
    private volatile boolean retrying = true;

    TrackedRetryFuture(String key) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
    }

    void recordFailure(int attempt, Throwable error) {
        this.attempts = attempt;
        this.error = error;
    }

    void recordSuccess(int attempt) {
        this.attempts = attempt;
        this.error = null;
    }

    /**
     * Marks the loop as no longer retrying. Waiters are released separately by {@link #release()}.
     */
    void finish(RetryException failure) {
        this.failure = failure;
        this.retrying = false;
    }

    void release() {
        done.countDown();
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean isRetrying() {
        return retrying;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public Optional<RetryException> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public void await() throws InterruptedException {
        done.await();
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        return "RetryFuture{" +
               "key='" + key + '\'' +
               ", retrying=" + retrying +
               ", attempts=" + attempts +
               ", error=" + error +
               '}';
    }
}
