// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * Subset of {@code eth_getTransactionByHash} needed to match a broadcast to its sender slot.
 *
 * @param blockNumber {@code null} while pending
 */
public record Transaction(
        Hash hash,
        Address from,
        @Nullable Address to,
        long nonce,
        @Nullable Long blockNumber) {

    public Transaction {
        Objects.requireNonNull(hash, "hash is required");
        Objects.requireNonNull(from, "from is required");
    }

    public boolean isMined() {
        return blockNumber != null;
    }

    public boolean matches(final Address sender, final long expectedNonce) {
        return from.equals(sender) && nonce == expectedNonce;
    }
}
