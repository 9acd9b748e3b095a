// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * A dispatched transaction identified by its sender slot.
 * <p>
 * {@link #submittedHash()} is whatever the wallet returned and is not trusted; it is absent
 * when the wallet reported the transaction as already known without a hash. Status moves
 * atomically; once CONFIRMED or FAILED it never changes again.
 */
public final class PendingTransaction {

    private final Address sender;
    private final long nonce;
    private final @Nullable Hash submittedHash;
    private final long submittedAtBlock;

    private TxStatus status = TxStatus.SUBMITTED;
    private @Nullable Hash confirmedHash;

    public PendingTransaction(
            final Address sender, final long nonce, final @Nullable Hash submittedHash, final long submittedAtBlock) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.nonce = nonce;
        this.submittedHash = submittedHash;
        this.submittedAtBlock = submittedAtBlock;
    }

    public Address sender() {
        return sender;
    }

    public long nonce() {
        return nonce;
    }

    public @Nullable Hash submittedHash() {
        return submittedHash;
    }

    /**
     * Chain head observed just before dispatch. The transaction cannot be in an earlier block.
     */
    public long submittedAtBlock() {
        return submittedAtBlock;
    }

    public synchronized TxStatus status() {
        return status;
    }

    public synchronized @Nullable Hash confirmedHash() {
        return confirmedHash;
    }

    /**
     * @return false if the transaction was already terminal
     */
    public synchronized boolean confirm(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        if (status.isTerminal()) {
            return false;
        }
        confirmedHash = hash;
        status = TxStatus.CONFIRMED;
        return true;
    }

    /**
     * Marks the transaction failed, recording the mined hash when one is known (a revert).
     *
     * @return false if the transaction was already terminal
     */
    public synchronized boolean fail(final @Nullable Hash minedHash) {
        if (status.isTerminal()) {
            return false;
        }
        confirmedHash = minedHash;
        status = TxStatus.FAILED;
        return true;
    }

    /**
     * Confirmation was not observed within the caller's deadline; the caller may keep waiting.
     */
    public synchronized boolean markUnknown() {
        if (status.isTerminal()) {
            return false;
        }
        status = TxStatus.UNKNOWN;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "PendingTransaction[sender=" + sender + ", nonce=" + nonce + ", submitted=" + submittedHash
                + ", status=" + status + ", confirmed=" + confirmedHash + "]";
    }
}
