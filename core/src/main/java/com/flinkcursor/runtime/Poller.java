package com.flinkcursor.runtime;

import com.flinkcursor.exception.SqlGatewayException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-interval retry loop driven by a scheduled executor.
 *
 * <p>Each attempt runs as a task scheduled one interval after the previous
 * attempt finished; the calling thread waits on a future for the loop to
 * end. State touched by the attempts is visible to the caller once the
 * blocking method returns.
 *
 * <p>Failures thrown by an attempt end the loop and are rethrown to the
 * caller unchanged when unchecked.
 */
public class Poller {

    private final ScheduledExecutorService scheduler;
    private final long intervalMs;

    /**
     * Creates a poller.
     *
     * @param scheduler the executor running the attempts
     * @param intervalMs the wait before each attempt in milliseconds
     */
    public Poller(ScheduledExecutorService scheduler, long intervalMs) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        if (intervalMs < 0) {
            throw new IllegalArgumentException("intervalMs must be non-negative");
        }
        this.intervalMs = intervalMs;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    /**
     * Probes until the probed value is accepted.
     *
     * <p>The first probe runs immediately on the calling thread; later
     * probes run one interval apart. There is no deadline.
     *
     * @param probe produces the current value
     * @param done accepts a final value
     * @param <T> the probed type
     * @return the first accepted value
     */
    public <T> T pollUntil(Supplier<T> probe, Predicate<? super T> done) {
        T value = probe.get();
        if (done.test(value)) {
            return value;
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        scheduleAttempt(result, () -> {
            T next = probe.get();
            if (done.test(next)) {
                result.complete(next);
                return true;
            }
            return false;
        });
        return await(result);
    }

    /**
     * Runs a step repeatedly until the stop condition holds.
     *
     * <p>The condition is checked before the first step and after each one;
     * every step is preceded by one interval.
     *
     * @param done the stop condition
     * @param step the work to repeat
     */
    public void repeatUntil(BooleanSupplier done, Runnable step) {
        if (done.getAsBoolean()) {
            return;
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        scheduleAttempt(result, () -> {
            step.run();
            if (done.getAsBoolean()) {
                result.complete(null);
                return true;
            }
            return false;
        });
        await(result);
    }

    private void scheduleAttempt(CompletableFuture<?> result, BooleanSupplier attempt) {
        if (result.isDone()) {
            return;
        }
        scheduler.schedule(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                if (!attempt.getAsBoolean()) {
                    scheduleAttempt(result, attempt);
                }
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }, intervalMs, TimeUnit.MILLISECONDS);
    }

    private static <T> T await(CompletableFuture<T> result) {
        try {
            return result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SqlGatewayException("Polling failed", cause);
        } catch (InterruptedException e) {
            result.cancel(false);
            Thread.currentThread().interrupt();
            throw new SqlGatewayException("Interrupted while polling the SQL gateway", e);
        }
    }
}
