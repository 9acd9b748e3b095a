// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.tx.LegacyTransaction;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;

/**
 * Transaction fields as handed to a wallet. Nullable fields are resolved by the submitter
 * before dispatch; a fully prepared request always carries an explicit nonce.
 *
 * @param to recipient; {@code null} for contract creation
 */
public record TransactionRequest(
        Address from,
        @Nullable Address to,
        Wei value,
        HexData data,
        @Nullable Long gasLimit,
        @Nullable Wei gasPrice,
        @Nullable Long nonce) {

    public TransactionRequest {
        Objects.requireNonNull(from, "from is required");
        value = value != null ? value : Wei.ZERO;
        data = data != null ? data : HexData.EMPTY;
    }

    public TransactionRequest withNonce(final long newNonce) {
        return new TransactionRequest(from, to, value, data, gasLimit, gasPrice, newNonce);
    }

    public TransactionRequest withGas(final long newGasLimit, final Wei newGasPrice) {
        return new TransactionRequest(from, to, value, data, newGasLimit, newGasPrice, nonce);
    }

    public boolean isPrepared() {
        return gasLimit != null && gasPrice != null && nonce != null;
    }

    /**
     * Converts a prepared request into an unsigned legacy transaction.
     *
     * @throws IllegalStateException if gas or nonce are unresolved
     */
    public LegacyTransaction toLegacyTransaction() {
        if (!isPrepared()) {
            throw new IllegalStateException("gasLimit, gasPrice and nonce must be resolved before signing");
        }
        return new LegacyTransaction(nonce, gasPrice, gasLimit, to, value, data);
    }

    /**
     * JSON-RPC transaction object as used by {@code eth_sendTransaction} and {@code eth_estimateGas}.
     * Unresolved fields are omitted.
     */
    public Map<String, Object> toRpcObject() {
        final Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", from.value());
        if (to != null) {
            tx.put("to", to.value());
        }
        tx.put("value", value.toHexString());
        if (!data.isEmpty()) {
            tx.put("data", data.value());
        }
        if (gasLimit != null) {
            tx.put("gas", "0x" + Long.toHexString(gasLimit));
        }
        if (gasPrice != null) {
            tx.put("gasPrice", gasPrice.toHexString());
        }
        if (nonce != null) {
            tx.put("nonce", "0x" + Long.toHexString(nonce));
        }
        return tx;
    }
}
