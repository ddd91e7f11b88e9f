/**
 * Backoff policies deciding the delay between retry attempts, such as
 * {@link com.sailfish.retry.backoff.IntervalBackOff}, {@link com.sailfish.retry.backoff.FixedAttemptsBackOff}
 * and {@link com.sailfish.retry.backoff.ExponentialBackOff}.
 */
package com.sailfish.retry.backoff;
