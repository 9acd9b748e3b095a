// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.concurrent.atomic.AtomicBoolean;

import sh.conduit.core.types.Address;

/**
 * Exclusive hold on a sender's next nonce. Exactly one of {@link #confirm()}, {@link #fail()} or
 * {@link #override()} releases it; later calls return false.
 */
public final class NonceLease {

    private final NonceSequencer owner;
    private final NonceSequencer.Lane lane;
    private final Address sender;
    private final long nonce;
    private final AtomicBoolean released = new AtomicBoolean();

    NonceLease(final NonceSequencer owner, final NonceSequencer.Lane lane, final Address sender, final long nonce) {
        this.owner = owner;
        this.lane = lane;
        this.sender = sender;
        this.nonce = nonce;
    }

    public Address sender() {
        return sender;
    }

    public long nonce() {
        return nonce;
    }

    NonceSequencer.Lane lane() {
        return lane;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** The transaction reached a block; the next reservation gets {@code nonce + 1} or later. */
    public boolean confirm() {
        return release(NonceSequencer.Outcome.CONFIRMED);
    }

    /** The nonce was never consumed; the next reservation re-reads the network. */
    public boolean fail() {
        return release(NonceSequencer.Outcome.FAILED);
    }

    /**
     * Caller gives up waiting and treats the nonce as spent. Used after a confirmation timeout
     * when the transaction may still mine.
     */
    public boolean override() {
        return release(NonceSequencer.Outcome.OVERRIDDEN);
    }

    private boolean release(final NonceSequencer.Outcome outcome) {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        owner.release(this, outcome);
        return true;
    }

    @Override
    public String toString() {
        return "NonceLease[" + sender + "#" + nonce + (released.get() ? ", released" : "") + "]";
    }
}
