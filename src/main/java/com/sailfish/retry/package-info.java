/**
 * Provides the retry-with-backoff core: the blocking loop in {@link com.sailfish.retry.Retries},
 * the task contract {@link com.sailfish.retry.RetryTask} and the terminal
 * {@link com.sailfish.retry.RetryException}.
 * Backoff policies, cancellation and the asynchronous registry live in subpackages.
 */
package com.sailfish.retry;
