// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import java.util.Objects;

/**
 * Root of all failures raised by this library. Every instance carries an {@link ErrorKind}.
 */
public sealed class ConduitException extends RuntimeException
        permits RpcException,
        WalletException,
        TxnException,
        AuthException {

    private final ErrorKind kind;

    public ConduitException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ConduitException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
