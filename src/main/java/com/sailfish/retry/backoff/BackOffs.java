package com.sailfish.retry.backoff;

import java.time.Duration;

/**
 * Factory methods for the built-in {@link BackOff} policies.
 */
public final class BackOffs {

    private BackOffs() {
    }

    /**
     * Retries forever with a fixed delay.
     */
    public static BackOff interval(Duration interval) {
        return new IntervalBackOff(interval);
    }

    /**
     * Retries with a fixed delay until {@code maxAttempts} attempts have failed.
     */
    public static BackOff attempts(int maxAttempts, Duration interval) {
        return new FixedAttemptsBackOff(maxAttempts, interval);
    }

    public static ExponentialBackOff exponential(Duration minDelay, Duration maxDelay, double factor) {
        return new ExponentialBackOff(minDelay, maxDelay, factor);
    }

    public static ExponentialBackOff exponential(Duration minDelay, Duration maxDelay, double factor, int maxAttempts) {
        return new ExponentialBackOff(minDelay, maxDelay, factor, maxAttempts);
    }
}
