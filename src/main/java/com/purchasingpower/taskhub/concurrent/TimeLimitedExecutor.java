package com.purchasingpower.taskhub.concurrent;

import com.purchasingpower.taskhub.exception.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs blocking backend calls on the storage executor with a deadline.
 *
 * <p>The returned future completes with the call's result, with the exception the call
 * threw, or with {@link OperationTimeoutException} when the deadline passes first. On
 * timeout the running call is interrupted so it does not keep a worker busy in the
 * background; backends that ignore interruption finish on their own and their late
 * result is discarded.
 *
 * @since 1.0.0
 */
@Slf4j
public class TimeLimitedExecutor {

    private final AsyncTaskExecutor executor;
    private final TaskScheduler scheduler;

    public TimeLimitedExecutor(AsyncTaskExecutor executor, TaskScheduler scheduler) {
        this.executor = executor;
        this.scheduler = scheduler;
    }

    /**
     * Run {@code call} with a deadline.
     *
     * @param sourceId source the call targets, reported on timeout
     * @param action short description of the call, reported on timeout
     */
    public <T> CompletableFuture<T> call(String sourceId, String action, Callable<T> call, Duration timeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> running;
        try {
            running = executor.submit(() -> {
                try {
                    result.complete(call.call());
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
            return result;
        }

        ScheduledFuture<?> deadline = scheduler.schedule(() -> {
            if (result.completeExceptionally(new OperationTimeoutException(sourceId, action, timeout))) {
                log.debug("Interrupting {} on source {} after {}ms", action, sourceId, timeout.toMillis());
                running.cancel(true);
            }
        }, Instant.now().plus(timeout));

        result.whenComplete((value, error) -> deadline.cancel(false));
        return result;
    }

    /**
     * Run {@code call} on the storage executor without a deadline.
     */
    public <T> CompletableFuture<T> call(Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(call.call());
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Schedule a one-off task. The caller owns the returned handle.
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return scheduler.schedule(task, Instant.now().plus(delay));
    }

    /**
     * Schedule a repeating task, first run after one period. The caller owns the returned handle.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return scheduler.scheduleAtFixedRate(task, Instant.now().plus(period), period);
    }
}
