package com.sailfish.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed delay between attempts, giving up once {@code maxAttempts} attempts have failed.
 */
public class FixedAttemptsBackOff implements BackOff {

    private final int maxAttempts;
    private final Duration interval;

    /**
     * @param maxAttempts Total number of attempts allowed, including the first one.
     * @param interval Delay between two consecutive attempts.
     */
    public FixedAttemptsBackOff(int maxAttempts, Duration interval) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must not be negative");
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    @Override
    public BackOffExecution start() {
        return new Execution();
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInterval() { return interval; }

    @Override
    public String toString() {
        return "FixedAttemptsBackOff{maxAttempts=" + maxAttempts + ", interval=" + interval + '}';
    }

    private final class Execution implements BackOffExecution {
        private int retries;

        @Override
        public Optional<Duration> nextDelay(int attempt) {
            retries++;
            if (retries >= maxAttempts) {
                return Optional.empty();
            }
            return Optional.of(interval);
        }

        @Override
        public int getRetries() {
            return retries;
        }
    }
}
