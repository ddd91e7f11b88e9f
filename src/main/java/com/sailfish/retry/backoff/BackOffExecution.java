package com.sailfish.retry.backoff;

import java.time.Duration;
import java.util.Optional;

/**
 * A single use of a {@link BackOff} policy. Holds the retry counter for one retry loop.
 * <p>
 * Not thread-safe: an execution belongs to the loop that started it.
 */
public interface BackOffExecution {

    /**
     * Consults the policy after a failed attempt.
     *
     * @param attempt The 1-based number of the attempt that just failed.
     * @return The delay to wait before the next attempt, or empty if the attempt budget is exhausted.
     */
    Optional<Duration> nextDelay(int attempt);

    /**
     * @return How many times {@link #nextDelay(int)} has been consulted on this execution.
     */
    int getRetries();

}
