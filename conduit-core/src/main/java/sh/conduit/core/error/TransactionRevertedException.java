// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import sh.conduit.core.types.Hash;

public final class TransactionRevertedException extends TxnException {

    private final Hash hash;

    public TransactionRevertedException(final Hash hash) {
        super(ErrorKind.TRANSACTION_REVERTED, "Transaction " + hash + " was mined but reverted");
        this.hash = hash;
    }

    public Hash hash() {
        return hash;
    }
}
