package com.docingest.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget for one ingestion request. A zero or negative budget never expires.
 */
public final class IngestionDeadline {
    private final Clock clock;
    private final Duration budget;
    private final Instant expiresAt;

    private IngestionDeadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.budget = budget;
        this.expiresAt = budget.isZero() || budget.isNegative() ? null : clock.instant().plus(budget);
    }

    public static IngestionDeadline after(Duration budget, Clock clock) {
        return new IngestionDeadline(clock, budget);
    }

    public static IngestionDeadline none() {
        return new IngestionDeadline(Clock.systemUTC(), Duration.ZERO);
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void check(String step) {
        if (isExpired()) {
            throw new IngestionDeadlineExceededException(step, budget);
        }
    }
}
