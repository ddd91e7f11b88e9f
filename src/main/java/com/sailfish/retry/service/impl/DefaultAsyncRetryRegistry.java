package com.sailfish.retry.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.sailfish.retry.RetryTask;
import com.sailfish.retry.backoff.BackOff;
import com.sailfish.retry.cancel.CancellationContext;
import com.sailfish.retry.model.RetryFuture;
import com.sailfish.retry.service.AsyncRetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the AsyncRetryRegistry.
 * <p>
 * Entries are reaped as soon as their loop ends: {@link #size()} counts running loops only,
 * while callers keep reading the finished state through the handle they were given.
 * A caller-supplied executor is shut down by {@link #shutdown(long)} as well.
 */
public class DefaultAsyncRetryRegistry implements AsyncRetryRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultAsyncRetryRegistry.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService executor;
    private final Object lock = new Object();
    private final Map<String, TrackedRetryFuture> futures = new HashMap<>(); // guarded by lock

    /**
     * Creates a registry running its loops on a cached pool of daemon threads.
     */
    public DefaultAsyncRetryRegistry() {
        this(Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("retry-async-%d")
                .setDaemon(true)
                .build()));
    }

    public DefaultAsyncRetryRegistry(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        log.info("AsyncRetryRegistry initialized.");
    }

    @PostConstruct
    public void start() {
        if (executor.isShutdown() || executor.isTerminated()) {
            log.error("AsyncRetryRegistry executor is not operational on startup!");
            return;
        }
        log.info("AsyncRetryRegistry started and ready to accept retry loops.");
    }

    @Override
    public RetryFuture async(String key, CancellationContext context, BackOff backOff, RetryTask task) {
        Preconditions.checkArgument(key != null && !key.trim().isEmpty(), "key cannot be blank");
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(backOff, "backOff cannot be null");
        Objects.requireNonNull(task, "task cannot be null");

        synchronized (lock) {
            TrackedRetryFuture existing = futures.get(key);
            if (existing != null && existing.isRetrying()) {
                log.debug("Retry loop for key '{}' already running, returning its future", key);
                return existing;
            }

            TrackedRetryFuture future = new TrackedRetryFuture(key);
            futures.put(key, future);
            try {
                executor.execute(new RetryLoopRunner(future, context, backOff, task, this::reap));
            } catch (RejectedExecutionException e) {
                futures.remove(key, future);
                log.error("Executor rejected retry loop for key '{}'. The registry might be shutting down.", key, e);
                throw e;
            }
            log.debug("Registered retry loop for key '{}'", key);
            return future;
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return futures.size();
        }
    }

    @Override
    public List<Throwable> errors() {
        synchronized (lock) {
            ImmutableList.Builder<Throwable> errors = ImmutableList.builder();
            for (TrackedRetryFuture future : futures.values()) {
                future.getError().ifPresent(errors::add);
            }
            return errors.build();
        }
    }

    @Override
    public void awaitAll() throws InterruptedException {
        List<TrackedRetryFuture> tracked;
        synchronized (lock) {
            tracked = ImmutableList.copyOf(futures.values());
        }
        log.debug("Waiting for {} retry loop(s) to finish", tracked.size());
        for (TrackedRetryFuture future : tracked) {
            future.await();
        }
    }

    /**
     * Shuts down with {@link #DEFAULT_SHUTDOWN_TIMEOUT_SECONDS}.
     */
    @PreDestroy
    public void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        log.info("Shutting down AsyncRetryRegistry with {} running loop(s)...", size());
        executor.shutdown(); // Disable new loops from being submitted
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Retry loops did not finish in {} seconds.", timeoutSeconds);
                List<Runnable> droppedLoops = executor.shutdownNow(); // Interrupts waiting loops, ending them as cancelled
                log.warn("Forcefully shutting down AsyncRetryRegistry. {} loops were never started.", droppedLoops.size());
                abandon(droppedLoops);
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("AsyncRetryRegistry executor did not terminate even after forceful shutdown.");
                }
            } else {
                log.info("AsyncRetryRegistry terminated gracefully.");
            }
        } catch (InterruptedException ie) {
            log.warn("AsyncRetryRegistry shutdown interrupted. Forcing shutdown now.");
            abandon(executor.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private void abandon(List<Runnable> droppedLoops) {
        for (Runnable dropped : droppedLoops) {
            if (dropped instanceof RetryLoopRunner) {
                ((RetryLoopRunner) dropped).abandon();
            }
        }
    }

    private void reap(TrackedRetryFuture future) {
        synchronized (lock) {
            if (futures.remove(future.getKey(), future)) {
                log.debug("Reaped finished retry loop for key '{}'", future.getKey());
            }
        }
    }
}
