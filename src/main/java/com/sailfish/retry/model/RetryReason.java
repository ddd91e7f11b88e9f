package com.sailfish.retry.model;

/**
 * Why a retry loop gave up.
 */
public enum RetryReason {
    /**
     * The cancellation context fired while waiting for the next attempt.
     */
    CANCELLED("context cancelled"),
    /**
     * The backoff policy ran out of attempts.
     */
    ATTEMPTS_EXHAUSTED("attempts exhausted"),
    /**
     * The task explicitly refused further attempts.
     */
    STOPPED("retry stopped");

    private final String description;

    RetryReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
