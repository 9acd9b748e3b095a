// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Failure while preparing, submitting or confirming a transaction.
 */
public non-sealed class TxnException extends ConduitException {

    public TxnException(final ErrorKind kind, final String message) {
        super(kind, message);
    }

    public TxnException(final ErrorKind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }
}
