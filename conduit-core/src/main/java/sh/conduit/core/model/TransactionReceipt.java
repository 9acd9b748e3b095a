// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

public record TransactionReceipt(
        Hash transactionHash,
        long blockNumber,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        boolean status) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
    }
}
