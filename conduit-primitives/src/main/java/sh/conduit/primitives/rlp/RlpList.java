// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.primitives.rlp;

import java.util.List;
import java.util.Objects;

/**
 * RLP list of nested items.
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        items = List.copyOf(items);
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(List.of(items));
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
