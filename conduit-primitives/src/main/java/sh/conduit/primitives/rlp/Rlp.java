// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.primitives.rlp;

import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix encoder.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {

    private Rlp() {
        // Utility class
    }

    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a byte string. A single byte below {@code 0x80} is its own encoding.
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        final int length = bytes.length;
        if (length == 1 && (bytes[0] & 0xFF) <= 0x7F) {
            return new byte[] { bytes[0] };
        }
        return withHeader(0x80, 0xB7, bytes);
    }

    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final byte[][] encodedItems = new byte[items.size()][];
        int payloadSize = 0;
        for (int i = 0; i < encodedItems.length; i++) {
            final RlpItem item = Objects.requireNonNull(items.get(i), "items cannot contain null values");
            encodedItems[i] = item.encode();
            payloadSize += encodedItems[i].length;
        }

        final byte[] payload = new byte[payloadSize];
        int offset = 0;
        for (final byte[] encoded : encodedItems) {
            System.arraycopy(encoded, 0, payload, offset, encoded.length);
            offset += encoded.length;
        }
        return withHeader(0xC0, 0xF7, payload);
    }

    private static byte[] withHeader(final int shortBase, final int longBase, final byte[] payload) {
        final int length = payload.length;
        if (length <= 55) {
            final byte[] result = new byte[1 + length];
            result[0] = (byte) (shortBase + length);
            System.arraycopy(payload, 0, result, 1, length);
            return result;
        }

        final int lengthSize = lengthSize(length);
        final byte[] result = new byte[1 + lengthSize + length];
        result[0] = (byte) (longBase + lengthSize);
        for (int i = lengthSize; i > 0; i--) {
            result[i] = (byte) (length >>> (8 * (lengthSize - i)));
        }
        System.arraycopy(payload, 0, result, 1 + lengthSize, length);
        return result;
    }

    private static int lengthSize(final int length) {
        int size = 0;
        int tmp = length;
        while (tmp != 0) {
            size++;
            tmp >>>= 8;
        }
        return size;
    }
}
