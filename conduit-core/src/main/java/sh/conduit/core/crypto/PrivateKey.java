// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.primitives.Hex;

/**
 * secp256k1 private key held by an embedded wallet.
 * <p>
 * The key can be destroyed when the owning session ends; any later use fails with
 * {@link IllegalStateException}. {@link #toString()} never prints key material.
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);
            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(Secp256k1Signer.CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.publicKey = new FixedPointCombMultiplier().multiply(Secp256k1Signer.CURVE.getG(), privateKeyValue);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes.clone());
    }

    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Signs a 32-byte digest. The returned {@code v} is the raw y-parity.
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return Secp256k1Signer.sign(messageHash, key);
    }

    /**
     * Signs text the way {@code personal_sign} does and returns the 65-byte signature.
     */
    public HexData signMessage(final String message) {
        return sign(PersonalMessage.hash(message)).toHexData();
    }

    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final ECPoint q = recoverPublicKey(
                signature.rAsBigInteger(), signature.sAsBigInteger(), messageHash, signature.recoveryId());
        if (q == null) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(q);
    }

    private static Address addressOf(final ECPoint point) {
        final byte[] encoded = point.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static ECPoint recoverPublicKey(
            final BigInteger r, final BigInteger s, final byte[] messageHash, final int recoveryId) {
        final BigInteger n = Secp256k1Signer.CURVE.getN();
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            return null;
        }

        final byte[] compressed = new byte[33];
        compressed[0] = (byte) ((recoveryId & 1) == 1 ? 0x03 : 0x02);
        System.arraycopy(Secp256k1Signer.toBytes32(r), 0, compressed, 1, 32);
        final ECPoint bigR;
        try {
            bigR = Secp256k1Signer.CURVE.getCurve().decodePoint(compressed);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (!bigR.isValid() || !bigR.multiply(n).isInfinity()) {
            return null;
        }

        // Q = r^-1 * (s*R - e*G)
        final BigInteger e = new BigInteger(1, messageHash);
        final BigInteger rInv = r.modInverse(n);
        final BigInteger srInv = rInv.multiply(s).mod(n);
        final BigInteger eInv = rInv.multiply(e).mod(n);
        return bigR.multiply(srInv).subtract(Secp256k1Signer.CURVE.getG().multiply(eInv)).normalize();
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
