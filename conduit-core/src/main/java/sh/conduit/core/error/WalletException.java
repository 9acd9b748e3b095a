// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Failure raised by a wallet provider adapter.
 */
public non-sealed class WalletException extends ConduitException {

    public WalletException(final ErrorKind kind, final String message) {
        super(kind, message);
    }

    public WalletException(final ErrorKind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }
}
