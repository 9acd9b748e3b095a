// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.crypto.Keccak256;
import sh.conduit.core.crypto.PrivateKey;
import sh.conduit.core.crypto.Signature;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;
import sh.conduit.primitives.rlp.Rlp;
import sh.conduit.primitives.rlp.RlpItem;
import sh.conduit.primitives.rlp.RlpString;

/**
 * Pre-EIP-2718 transaction signed with EIP-155 replay protection.
 * <p>
 * Embedded wallets sign these locally; the resulting envelope is broadcast through
 * {@code eth_sendRawTransaction}.
 */
public record LegacyTransaction(
        long nonce,
        Wei gasPrice,
        long gasLimit,
        @Nullable Address to,
        Wei value,
        HexData data) {

    public LegacyTransaction {
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
    }

    /**
     * RLP of {@code [nonce, gasPrice, gas, to, value, data, chainId, 0, 0]}.
     */
    public byte[] encodeForSigning(final long chainId) {
        final List<RlpItem> items = baseItems();
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(0L));
        items.add(RlpString.of(0L));
        return Rlp.encodeList(items);
    }

    /**
     * RLP of the signed envelope. {@code v} must already be EIP-155 encoded.
     */
    public byte[] encodeSigned(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (signature.v() < 35) {
            throw new IllegalArgumentException(
                    "Legacy transaction signature v must be EIP-155 encoded (>= 35), got: " + signature.v());
        }
        final List<RlpItem> items = baseItems();
        items.add(RlpString.of(signature.v()));
        items.add(RlpString.of(signature.rAsBigInteger()));
        items.add(RlpString.of(signature.sAsBigInteger()));
        return Rlp.encodeList(items);
    }

    public SignedTransaction sign(final PrivateKey key, final long chainId) {
        final Signature raw = key.sign(Keccak256.hash(encodeForSigning(chainId)));
        final Signature eip155 = new Signature(raw.r(), raw.s(), (int) (chainId * 2 + 35 + raw.v()));
        final byte[] envelope = encodeSigned(eip155);
        return new SignedTransaction(HexData.fromBytes(envelope), Hash.fromBytes(Keccak256.hash(envelope)));
    }

    private List<RlpItem> baseItems() {
        final List<RlpItem> items = new ArrayList<>(9);
        items.add(RlpString.of(nonce));
        items.add(RlpString.of(gasPrice.value()));
        items.add(RlpString.of(gasLimit));
        items.add(RlpString.of(to != null ? to.toBytes() : new byte[0]));
        items.add(RlpString.of(value.value()));
        items.add(RlpString.of(data.toBytes()));
        return items;
    }
}
