// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.conduit.core.types.HexData;
import sh.conduit.primitives.Hex;

/**
 * ECDSA signature over secp256k1.
 * <p>
 * {@code v} holds the raw recovery id (0 or 1) as produced by {@link Secp256k1Signer}, the
 * legacy 27/28 form used by {@code personal_sign}, or an EIP-155 value.
 */
public record Signature(byte[] r, byte[] s, int v) {

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    public BigInteger rAsBigInteger() {
        return new BigInteger(1, r);
    }

    public BigInteger sAsBigInteger() {
        return new BigInteger(1, s);
    }

    /**
     * @return the recovery id (0 or 1) regardless of how {@code v} is encoded
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        return (v - 35) & 1;
    }

    /**
     * Encodes as the 65-byte {@code r || s || v} form wallets return from {@code personal_sign},
     * with {@code v} in 27/28 form.
     */
    public HexData toHexData() {
        final byte[] out = new byte[65];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) (27 + recoveryId());
        return HexData.fromBytes(out);
    }

    public static Signature fromHexData(final HexData data) {
        final byte[] bytes = data.toBytes();
        if (bytes.length != 65) {
            throw new IllegalArgumentException("Signature must be 65 bytes, got " + bytes.length);
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Signature other
                && Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + Hex.encodeNoPrefix(Arrays.copyOf(r, 4)) + "..., v=" + v + "]";
    }
}
