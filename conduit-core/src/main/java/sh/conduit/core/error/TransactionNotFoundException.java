// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import sh.conduit.core.types.Address;

/**
 * No transaction matching the expected sender and nonce appeared within the retry budget.
 */
public final class TransactionNotFoundException extends TxnException {

    private final Address sender;
    private final long nonce;

    public TransactionNotFoundException(final Address sender, final long nonce, final int attempts) {
        super(ErrorKind.TRANSACTION_NOT_FOUND,
                "No transaction from " + sender + " with nonce " + nonce + " found after " + attempts + " attempts");
        this.sender = sender;
        this.nonce = nonce;
    }

    public Address sender() {
        return sender;
    }

    public long nonce() {
        return nonce;
    }
}
