// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.internal;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Hex quantity codecs and error-data extraction shared by the RPC layer.
 */
public final class RpcUtils {

    /** Shared, thread-safe mapper. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class
    }

    /**
     * Finds the first hex payload nested anywhere in a JSON-RPC error {@code data} field.
     * Nodes disagree on the shape: a bare string, an object, or a list.
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        if (dataValue.getClass().isArray()) {
            final int length = Array.getLength(dataValue);
            for (int i = 0; i < length; i++) {
                final String extracted = extractErrorData(Array.get(dataValue, i));
                if (extracted != null) {
                    return extracted;
                }
            }
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }

    public static Long decodeHexLong(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        final String normalized = cleanHex(value.toString());
        return normalized.isEmpty() ? 0L : Long.parseLong(normalized, 16);
    }

    public static BigInteger decodeHexBigInteger(final String hex) {
        if (hex == null) {
            return BigInteger.ZERO;
        }
        final String normalized = cleanHex(hex);
        return normalized.isEmpty() ? BigInteger.ZERO : new BigInteger(normalized, 16);
    }

    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toQuantityHex(final long value) {
        return "0x" + Long.toHexString(value);
    }

    private static String cleanHex(final String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
