package com.deepansh.rag.resilience;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.exception.DurableWriteException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * The two write policies used against the durable store.
 *
 * Best-effort: one attempt, time-boxed, every failure logged and swallowed.
 * Used on session creation where availability matters more than the row.
 *
 * Strict: up to N attempts, each with its own timeout, linearly growing
 * delay between attempts (delay, 2*delay, ...). A duplicate-key response means
 * an earlier attempt already landed and counts as success. Exhaustion throws
 * DurableWriteException so the caller can roll back.
 *
 * Writes run on the session task executor so a timed-out attempt cannot hold
 * the calling thread.
 */
@Slf4j
public class DurableWriteExecutor {

    private final Executor executor;
    private final Retry retry;
    private final TimeLimiter attemptLimiter;
    private final int maxAttempts;

    public DurableWriteExecutor(SessionProperties properties, Executor executor) {
        SessionProperties.Persistence persistence = properties.getPersistence();
        this.executor = executor;
        this.maxAttempts = Math.max(1, persistence.getSaveRetry());

        long delayMs = Math.max(1, persistence.getRetryDelay().toMillis());
        this.retry = Retry.of("durableWrite", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.of(delayMs, previous -> previous + delayMs))
                .retryOnException(e -> !(e instanceof DuplicateKeyException))
                .build());
        this.attemptLimiter = timeLimiter(persistence.getSaveTimeout());

        retry.getEventPublisher().onRetry(event ->
                log.warn("Durable write attempt {}/{} failed, retrying: {}",
                        event.getNumberOfRetryAttempts(), maxAttempts,
                        describe(event.getLastThrowable())));
    }

    /**
     * Never throws. Returns false when the write failed or ran out of time.
     */
    public boolean bestEffort(String operation, Runnable write, Duration budget) {
        try {
            timeLimiter(budget).executeFutureSupplier(() -> CompletableFuture.runAsync(write, executor));
            return true;
        } catch (TimeoutException e) {
            log.warn("Best-effort write timed out after {}ms, continuing [op={}]", budget.toMillis(), operation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Best-effort write interrupted [op={}]", operation);
        } catch (RejectedExecutionException e) {
            log.warn("Best-effort write rejected, executor saturated [op={}]", operation);
        } catch (Exception e) {
            log.error("Best-effort write failed, continuing [op={}]: {}", operation, e.getMessage());
        }
        return false;
    }

    /**
     * @throws DurableWriteException after the last attempt fails
     */
    public void strict(String operation, Runnable write) {
        try {
            retry.executeCallable(() -> {
                try {
                    attemptLimiter.executeFutureSupplier(() -> CompletableFuture.runAsync(write, executor));
                } catch (DuplicateKeyException e) {
                    log.debug("Duplicate key on write, already stored [op={}]", operation);
                }
                return null;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DurableWriteException(operation, maxAttempts, e);
        } catch (Exception e) {
            log.error("Durable write failed after {} attempt(s) [op={}]: {}",
                    maxAttempts, operation, describe(e));
            throw new DurableWriteException(operation, maxAttempts, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static TimeLimiter timeLimiter(Duration timeout) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        return t instanceof TimeoutException ? "timeout" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
