// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.conduit.primitives.Hex;

/**
 * Arbitrary-length {@code 0x}-prefixed byte data: call data, signatures, signed transactions.
 */
public record HexData(@JsonValue String value) {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData("0x");

    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    public boolean isEmpty() {
        return value.length() == 2;
    }

    /**
     * Returns the 4-byte function selector, or {@code null} when the data is shorter than a selector.
     */
    public String selector() {
        return byteLength() >= 4 ? value.substring(0, 10) : null;
    }

    @Override
    public String toString() {
        return value;
    }
}
