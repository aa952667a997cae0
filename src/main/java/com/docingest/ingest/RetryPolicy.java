package com.docingest.ingest;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries transient {@link ExternalCallException}s with a linear backoff of {@code backoffMs * attempt}.
 * Anything else, including permanent external failures, is rethrown on the first attempt.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long backoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long backoffMs) {
        this(maxAttempts, backoffMs, Thread::sleep);
    }

    RetryPolicy(int maxAttempts, long backoffMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoffMs must not be negative: " + backoffMs);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
        this.sleeper = sleeper;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String step, IngestionDeadline deadline, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            deadline.check(step);
            try {
                return call.get();
            } catch (ExternalCallException e) {
                if (!e.isTransient() || attempt >= maxAttempts) {
                    throw e;
                }
                long backoff = backoffMs * attempt;
                if (deadline.remaining().compareTo(Duration.ofMillis(backoff)) < 0) {
                    throw e;
                }
                log.warn("ingest.retry step={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        step, attempt, maxAttempts, backoff, e.getMessage());
                pause(backoff, e);
            }
        }
    }

    private void pause(long backoff, ExternalCallException pending) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(interrupted);
            throw pending;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
