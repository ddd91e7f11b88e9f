package com.sailfish.retry.backoff;

/**
 * Defines how long to wait between attempts of a retried operation and when to give up.
 * <p>
 * A BackOff is immutable configuration and may be shared freely between threads. The
 * mutable attempt counter lives in the {@link BackOffExecution} returned by {@link #start()},
 * so every retry loop gets its own.
 *
 * @see BackOffs
 */
public interface BackOff {

    /**
     * Starts a new, independent execution of this policy with its counter at zero.
     *
     * @return A fresh execution, to be confined to a single retry loop.
     */
    BackOffExecution start();

}
