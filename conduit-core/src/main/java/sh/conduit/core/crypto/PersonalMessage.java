// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;

/**
 * EIP-191 version 0x45 ("personal_sign") message hashing and signer recovery.
 */
public final class PersonalMessage {

    private static final String PREFIX = "\u0019Ethereum Signed Message:\n";

    private PersonalMessage() {
    }

    public static byte[] hash(final String message) {
        Objects.requireNonNull(message, "message");
        return hash(message.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] hash(final byte[] message) {
        Objects.requireNonNull(message, "message");
        final byte[] prefix = (PREFIX + message.length).getBytes(StandardCharsets.UTF_8);
        return Keccak256.hash(prefix, message);
    }

    /**
     * Recovers the address that produced a 65-byte {@code personal_sign} signature.
     *
     * @throws IllegalArgumentException if the signature is malformed or unrecoverable
     */
    public static Address recoverSigner(final String message, final HexData signature) {
        return PrivateKey.recoverAddress(hash(message), Signature.fromHexData(signature));
    }
}
