package com.sailfish.retry;

import java.util.Objects;

/**
 * Marks a failure as non-retryable. A retry loop that sees this exception, directly or anywhere in
 * the causal chain of what the task threw, ends with {@link com.sailfish.retry.model.RetryReason#STOPPED}.
 *
 * @see Retries#stop(Throwable)
 */
public class StopRetryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StopRetryException(Throwable cause) {
        super(Objects.requireNonNull(cause, "cause cannot be null").getMessage(), cause);
    }
}
