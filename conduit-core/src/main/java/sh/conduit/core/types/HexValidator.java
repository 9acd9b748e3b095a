// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length {@code 0x}-prefixed hex strings.
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a pattern matching {@code 0x} followed by {@code byteLength * 2} hex characters
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
