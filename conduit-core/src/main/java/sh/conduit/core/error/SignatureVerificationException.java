// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

public final class SignatureVerificationException extends AuthException {

    public SignatureVerificationException(final String message) {
        super(ErrorKind.SIGNATURE_VERIFICATION_FAILED, message);
    }
}
