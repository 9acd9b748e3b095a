// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Hash;

/**
 * A caller deadline elapsed. Recoverable: the transaction is still pending and the caller may
 * keep polling.
 */
public final class TransactionTimeoutException extends TxnException {

    private final @Nullable Hash hash;

    public TransactionTimeoutException(final String message, final @Nullable Hash hash) {
        super(ErrorKind.TRANSACTION_TIMEOUT, message);
        this.hash = hash;
    }

    /**
     * @return the hash being awaited, if one was known when the deadline elapsed
     */
    public @Nullable Hash hash() {
        return hash;
    }
}
