package com.sailfish.retry;

import com.google.common.base.Throwables;
import com.sailfish.retry.backoff.BackOff;
import com.sailfish.retry.backoff.BackOffExecution;
import com.sailfish.retry.cancel.CancellationContext;
import com.sailfish.retry.model.RetryReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Blocking retry loop.
 * <p>
 * Usage
 * <pre>
 * {@code
 * Retries.until(context, BackOffs.attempts(5, Duration.ofMillis(200)), (ctx, attempt) -> {
 *     if (!client.isReachable()) {
 *         throw new IOException("not reachable");
 *     }
 *     if (client.isBanned()) {
 *         throw Retries.stop(new IllegalStateException("banned"));
 *     }
 * });
 * }
 * </pre>
 */
public final class Retries {

    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    /**
     * Wraps a failure so that the retry loop does not retry it.
     *
     * @param cause The failure to report as the cause of the stop.
     * @return The exception to throw from the task.
     */
    public static StopRetryException stop(Throwable cause) {
        return new StopRetryException(cause);
    }

    /**
     * Runs the task on the calling thread until it succeeds or the loop has to give up.
     * <p>
     * The first attempt runs immediately. After each failure the backoff policy is consulted and
     * the loop waits for the returned delay, unless the context is cancelled first. An attempt
     * already running is never interrupted; cancellation is only observed while waiting.
     *
     * @param context Cancellation signal observed between attempts.
     * @param backOff Policy deciding the delays and the attempt budget. A fresh execution is started per call.
     * @param task The work to run.
     * @throws RetryException if the loop was cancelled, ran out of attempts, or the task asked to stop.
     */
    public static void until(CancellationContext context, BackOff backOff, RetryTask task) throws RetryException {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(backOff, "backOff cannot be null");
        Objects.requireNonNull(task, "task cannot be null");

        BackOffExecution execution = backOff.start();
        int attempt = 0;
        while (true) {
            attempt++;
            Exception failure;
            try {
                task.execute(context, attempt);
                if (attempt > 1) {
                    log.debug("Attempt {} succeeded after {} failure(s)", attempt, attempt - 1);
                }
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryException(attempt, RetryReason.CANCELLED, e);
            } catch (Exception e) {
                failure = e;
            }

            Optional<StopRetryException> stop = findStop(failure);
            if (stop.isPresent()) {
                log.debug("Attempt {} asked to stop retrying: {}", attempt, failure.getMessage());
                throw new RetryException(attempt, RetryReason.STOPPED, stop.get().getCause());
            }

            Optional<Duration> delay = execution.nextDelay(attempt);
            if (!delay.isPresent()) {
                log.debug("Attempt {} failed and no attempts are left: {}", attempt, failure.getMessage());
                throw new RetryException(attempt, RetryReason.ATTEMPTS_EXHAUSTED, failure);
            }

            log.debug("Attempt {} failed: {}. Retrying in {}", attempt, failure.getMessage(), delay.get());
            if (awaitCancellation(context, delay.get())) {
                log.debug("Cancelled while waiting after attempt {}", attempt);
                throw new RetryException(attempt, RetryReason.CANCELLED, failure);
            }
        }
    }

    private static Optional<StopRetryException> findStop(Throwable failure) {
        return Throwables.getCausalChain(failure).stream()
                .filter(StopRetryException.class::isInstance)
                .map(StopRetryException.class::cast)
                .findFirst();
    }

    private static boolean awaitCancellation(CancellationContext context, Duration delay) {
        try {
            return context.awaitCancellation(delay);
        } catch (InterruptedException e) {
            // Interrupting the waiting thread counts as cancellation
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
