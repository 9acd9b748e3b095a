// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Caller-supplied point in time after which a wait gives up with a timeout.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(final Clock clock, final Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(final Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(final Duration timeout, final Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public Duration remaining() {
        final Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * The earlier of the two deadlines, on this deadline's clock.
     */
    public Deadline min(final Deadline other) {
        return other.expiresAt.isBefore(expiresAt) ? new Deadline(clock, other.expiresAt) : this;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public String toString() {
        return "Deadline[" + expiresAt + ", remaining=" + remaining() + "]";
    }
}
