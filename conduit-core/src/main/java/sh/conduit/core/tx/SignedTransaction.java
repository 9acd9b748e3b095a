// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.tx;

import java.util.Objects;

import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;

/**
 * Signed envelope ready for {@code eth_sendRawTransaction}, with the hash it will be mined under.
 */
public record SignedTransaction(HexData raw, Hash hash) {

    public SignedTransaction {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(hash, "hash");
    }

    @Override
    public String toString() {
        return "SignedTransaction[hash=" + hash + ", bytes=" + raw.byteLength() + "]";
    }
}
