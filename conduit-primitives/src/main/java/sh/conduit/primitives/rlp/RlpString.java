// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * RLP byte string. Numeric factories use the minimal big-endian form with no leading zeros.
 */
public record RlpString(byte[] bytes) implements RlpItem {

    public RlpString {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    public static RlpString of(final byte[] bytes) {
        return new RlpString(bytes);
    }

    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value == 0) {
            return new RlpString(new byte[0]);
        }
        final int size = (64 - Long.numberOfLeadingZeros(value) + 7) >>> 3;
        final byte[] result = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            result[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return new RlpString(result);
    }

    public static RlpString of(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value.signum() == 0) {
            return new RlpString(new byte[0]);
        }
        final byte[] raw = value.toByteArray();
        return new RlpString(raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof RlpString other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
