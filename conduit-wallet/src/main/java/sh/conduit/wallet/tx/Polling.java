// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.types.Hash;

final class Polling {

    private Polling() {
    }

    /**
     * Sleeps for {@code delay}, cut short at the deadline. An interrupt surfaces as a timeout so
     * the caller can keep waiting out-of-band.
     */
    static void pause(final Sleeper sleeper, final Duration delay, final Deadline deadline, final @Nullable Hash hash) {
        final Duration remaining = deadline.remaining();
        final Duration actual = delay.compareTo(remaining) < 0 ? delay : remaining;
        if (actual.isZero()) {
            return;
        }
        try {
            sleeper.sleep(actual);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final TransactionTimeoutException timeout =
                    new TransactionTimeoutException("Interrupted while waiting for confirmation", hash);
            timeout.addSuppressed(e);
            throw timeout;
        }
    }
}
