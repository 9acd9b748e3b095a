// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.primitives.Hex;

class PrivateKeyTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";

    @Test
    void derivesKnownAddress() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        assertEquals(new Address("0x2c7536E3605D9C16a7a3D7b1898e529396a65c23"), key.toAddress());
    }

    @Test
    void keccakOfEmptyInput() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void signedMessageRecoversToSigner() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        String message = "Authenticate wallet at 2024-01-01T00:00:00Z";

        HexData signature = key.signMessage(message);

        assertEquals(65, signature.byteLength());
        int v = signature.toBytes()[64] & 0xFF;
        assertTrue(v == 27 || v == 28, "personal_sign v must be 27 or 28");
        assertEquals(key.toAddress(), PersonalMessage.recoverSigner(message, signature));
    }

    @Test
    void signingIsDeterministicAndLowS() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        byte[] digest = Keccak256.hash("payload".getBytes(StandardCharsets.UTF_8));

        Signature first = key.sign(digest);
        Signature second = key.sign(digest);

        assertEquals(first, second);
        assertTrue(first.sAsBigInteger().compareTo(
                Secp256k1Signer.CURVE.getN().shiftRight(1)) <= 0);
    }

    @Test
    void recoveryOfDifferentMessageYieldsDifferentAddress() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        HexData signature = key.signMessage("original");

        assertNotEquals(key.toAddress(), PersonalMessage.recoverSigner("tampered", signature));
    }

    @Test
    void destroyedKeyRefusesToSign() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.signMessage("hi"));
        assertEquals("PrivateKey[destroyed]", key.toString());
    }
}
