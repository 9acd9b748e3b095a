// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Wei;

/**
 * Optional caller overrides. A gas limit hint skips estimation; a gas price hint replaces the
 * network price but is still checked against the policy bounds.
 */
public record TransactionHints(@Nullable Long gasLimit, @Nullable Wei gasPrice) {

    public static final TransactionHints NONE = new TransactionHints(null, null);

    public TransactionHints {
        if (gasLimit != null && gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit hint must be positive");
        }
    }

    public static TransactionHints gasLimit(final long gasLimit) {
        return new TransactionHints(gasLimit, null);
    }
}
