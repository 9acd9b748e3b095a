// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

public final class NotConnectedException extends WalletException {

    public NotConnectedException(final String message) {
        super(ErrorKind.NOT_CONNECTED, message);
    }

    public NotConnectedException(final String message, final Throwable cause) {
        super(ErrorKind.NOT_CONNECTED, message, cause);
    }
}
