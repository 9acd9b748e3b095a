// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.util.List;
import java.util.Objects;

import sh.conduit.core.types.Hash;

/**
 * Block fetched with {@code eth_getBlockByNumber(n, false)}: header identity and transaction hashes.
 */
public record BlockSummary(long number, Hash hash, List<Hash> transactionHashes) {

    public BlockSummary {
        Objects.requireNonNull(hash, "hash cannot be null");
        transactionHashes = List.copyOf(Objects.requireNonNull(transactionHashes, "transactionHashes"));
    }
}
