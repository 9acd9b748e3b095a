// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Failure while exchanging a wallet proof for a backend session token.
 */
public non-sealed class AuthException extends ConduitException {

    public AuthException(final ErrorKind kind, final String message) {
        super(kind, message);
    }

    public AuthException(final ErrorKind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }
}
