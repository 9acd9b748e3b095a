// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import sh.conduit.core.types.Address;

public final class NonceCollisionException extends TxnException {

    private final Address sender;
    private final long nonce;

    public NonceCollisionException(final Address sender, final long nonce, final Throwable cause) {
        super(ErrorKind.NONCE_COLLISION, "Nonce " + nonce + " already used for " + sender, cause);
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
