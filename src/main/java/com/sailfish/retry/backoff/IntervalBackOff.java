package com.sailfish.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed delay between attempts and no attempt limit. Only cancellation ends a loop driven
 * by this policy.
 */
public class IntervalBackOff implements BackOff {

    private final Duration interval;

    public IntervalBackOff(Duration interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must not be negative");
        this.interval = interval;
    }

    @Override
    public BackOffExecution start() {
        return new Execution();
    }

    public Duration getInterval() { return interval; }

    @Override
    public String toString() {
        return "IntervalBackOff{interval=" + interval + '}';
    }

    private final class Execution implements BackOffExecution {
        private int retries;

        @Override
        public Optional<Duration> nextDelay(int attempt) {
            retries++;
            return Optional.of(interval);
        }

        @Override
        public int getRetries() {
            return retries;
        }
    }
}
