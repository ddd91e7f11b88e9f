package com.sailfish.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A backoff policy whose delay grows geometrically with the attempt number.
 * <p>
 * The delay after attempt {@code k} is {@code min(maxDelay, minDelay * factor^k)}, never less
 * than {@code minDelay}. With {@code maxAttempts > 0} the policy gives up once that many
 * attempts have failed; {@code 0} means no limit.
 */
public class ExponentialBackOff implements BackOff {

    private final Duration minDelay;
    private final Duration maxDelay;
    private final double factor;
    private final int maxAttempts;

    public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_FACTOR = 2.0;
    public static final int UNLIMITED_ATTEMPTS = 0;

    /**
     * Creates a default ExponentialBackOff.
     * Min Delay: 100 milliseconds
     * Max Delay: 30 seconds
     * Factor: 2.0
     * Attempts: unlimited
     */
    public ExponentialBackOff() {
        this(DEFAULT_MIN_DELAY, DEFAULT_MAX_DELAY, DEFAULT_FACTOR, UNLIMITED_ATTEMPTS);
    }

    public ExponentialBackOff(Duration minDelay, Duration maxDelay, double factor) {
        this(minDelay, maxDelay, factor, UNLIMITED_ATTEMPTS);
    }

    /**
     * Creates a configurable ExponentialBackOff.
     *
     * @param minDelay Smallest delay, also the base of the geometric growth.
     * @param maxDelay Cap applied once the computed delay exceeds it.
     * @param factor Growth factor per attempt, at least 1.0.
     * @param maxAttempts Total attempts allowed, or {@link #UNLIMITED_ATTEMPTS}.
     */
    public ExponentialBackOff(Duration minDelay, Duration maxDelay, double factor, int maxAttempts) {
        if (minDelay == null || minDelay.isNegative() || minDelay.isZero()) throw new IllegalArgumentException("minDelay must be positive");
        Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (maxDelay.compareTo(minDelay) < 0) throw new IllegalArgumentException("maxDelay must not be less than minDelay");
        if (Double.isNaN(factor) || factor < 1.0) throw new IllegalArgumentException("factor must be at least 1.0");
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be non-negative");

        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.factor = factor;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public BackOffExecution start() {
        return new Execution();
    }

    /**
     * Computes the delay that follows a failure of the given attempt, ignoring the attempt limit.
     *
     * @param attempt The 1-based attempt number.
     * @return The clamped delay.
     */
    public Duration delayFor(int attempt) {
        double delayNanos = minDelay.toNanos() * Math.pow(factor, attempt);

        // Infinity and NaN both land on the cap
        if (!(delayNanos < maxDelay.toNanos())) {
            return maxDelay;
        }
        if (delayNanos < minDelay.toNanos()) {
            return minDelay;
        }
        return Duration.ofNanos((long) delayNanos);
    }

    // --- Getters for configuration ---
    public Duration getMinDelay() { return minDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getFactor() { return factor; }
    public int getMaxAttempts() { return maxAttempts; }

    @Override
    public String toString() {
        return "ExponentialBackOff{" +
               "minDelay=" + minDelay +
               ", maxDelay=" + maxDelay +
               ", factor=" + factor +
               ", maxAttempts=" + maxAttempts +
               '}';
    }

    private final class Execution implements BackOffExecution {
        private int retries;

        @Override
        public Optional<Duration> nextDelay(int attempt) {
            retries++;
            if (maxAttempts != UNLIMITED_ATTEMPTS && retries >= maxAttempts) {
                return Optional.empty();
            }
            return Optional.of(delayFor(attempt));
        }

        @Override
        public int getRetries() {
            return retries;
        }
    }
}
