// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

public final class BackendAuthException extends AuthException {

    private final int status;

    public BackendAuthException(final String message, final int status) {
        super(ErrorKind.BACKEND_AUTH_FAILED, message);
        this.status = status;
    }

    public BackendAuthException(final String message, final Throwable cause) {
        super(ErrorKind.BACKEND_AUTH_FAILED, message, cause);
        this.status = 0;
    }

    /**
     * @return the HTTP status returned by the backend, or 0 when no response arrived
     */
    public int status() {
        return status;
    }
}
