// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

public final class UserRejectedException extends WalletException {

    public UserRejectedException(final String message, final Throwable cause) {
        super(ErrorKind.USER_REJECTED, message, cause);
    }

    public UserRejectedException(final String message) {
        super(ErrorKind.USER_REJECTED, message);
    }
}
