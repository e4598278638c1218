package com.tracker.sync.retry;

import com.tracker.sync.adapter.TransientIOException;
import com.tracker.sync.metrics.NoOpSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs tracker calls, retrying {@link TransientIOException}s according to a {@link RetryPolicy}.
 * Any other exception propagates at once.
 */
public class RetryingExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    private final RetryPolicy policy;
    private final SyncMetrics metrics;
    private final Sleeper sleeper;

    public RetryingExecutor(RetryPolicy policy) {
        this(policy, NoOpSyncMetrics.INSTANCE, Sleeper.THREAD);
    }

    public RetryingExecutor(RetryPolicy policy, SyncMetrics metrics, Sleeper sleeper) {
        this.policy = policy;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * @throws TransientIOException the last failure once every attempt is used up
     */
    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientIOException e) {
                if (attempt >= policy.maxAttempts()) {
                    log.warn("retry.exhausted operation={} attempts={} error={}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = policy.delayAfter(attempt);
                log.info("retry.scheduled operation={} attempt={} delayMs={} error={}",
                        operation, attempt, delay.toMillis(), e.getMessage());
                metrics.incrementRetry();
                pause(operation, delay, e);
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void pause(String operation, Duration delay, TransientIOException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientIOException("Interrupted while waiting to retry " + operation, cause);
        }
    }

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

        void sleep(Duration delay) throws InterruptedException;
    }
}
