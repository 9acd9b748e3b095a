// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded polling policy shared by hash reconciliation, receipt polling and submission retries.
 *
 * @param maxAttempts    rounds before giving up
 * @param initialBackoff delay after the first round
 * @param maxBackoff     cap on a single delay
 * @param multiplier     growth factor between delays
 * @param totalBudget    wall-clock cap across all rounds
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier,
        Duration totalBudget) {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final Duration DEFAULT_TOTAL_BUDGET = Duration.ofMinutes(2);

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(totalBudget, "totalBudget");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (totalBudget.isNegative() || totalBudget.isZero()) {
            throw new IllegalArgumentException("totalBudget must be positive");
        }
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * Delay to wait after the given 1-based attempt.
     */
    public Duration delayFor(final int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        final double scaled = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        final long capped = (long) Math.min(scaled, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private double multiplier = DEFAULT_MULTIPLIER;
        private Duration totalBudget = DEFAULT_TOTAL_BUDGET;

        private Builder() {
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(final Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(final Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder multiplier(final double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder totalBudget(final Duration totalBudget) {
            this.totalBudget = totalBudget;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, multiplier, totalBudget);
        }
    }
}
