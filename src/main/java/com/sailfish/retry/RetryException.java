package com.sailfish.retry;

import com.google.common.base.MoreObjects;
import com.sailfish.retry.model.RetryReason;

import java.util.Objects;

/**
 * Terminal failure of a retry loop: how many attempts were made, why the loop gave up, and the
 * last failure of the task as the cause.
 */
public class RetryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final RetryReason reason;

    public RetryException(int attempts, RetryReason reason, Throwable cause) {
        super(formatMessage(attempts, reason, cause), cause);
        this.attempts = attempts;
        this.reason = reason;
    }

    /**
     * @return Number of attempts actually made, at least 1.
     */
    public int getAttempts() {
        return attempts;
    }

    public RetryReason getReason() {
        return reason;
    }

    private static String formatMessage(int attempts, RetryReason reason, Throwable cause) {
        if (attempts < 1) throw new IllegalArgumentException("attempts must be at least 1");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(cause, "cause cannot be null");
        String causeMessage = MoreObjects.firstNonNull(cause.getMessage(), cause.getClass().getName());
        return "on attempt '" + attempts + "'; " + reason.getDescription() + ": " + causeMessage;
    }
}
