// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.types.Address;
import sh.conduit.rpc.ChainReader;

/**
 * Hands out nonces one at a time per sender.
 * <p>
 * A sender has at most one outstanding {@link NonceLease}. Further reservations block until it
 * is released or the caller's deadline passes. With nothing in flight the next nonce is the
 * larger of the network's pending count and the last locally confirmed nonce plus one, so a
 * lagging node cannot hand back a nonce that was already used. State lives for the process
 * only.
 */
public final class NonceSequencer {

    private static final Logger LOG = LoggerFactory.getLogger(NonceSequencer.class);

    enum Outcome { CONFIRMED, FAILED, OVERRIDDEN }

    private final ChainReader reader;
    private final Map<Address, Lane> lanes = new ConcurrentHashMap<>();

    public NonceSequencer(final ChainReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * @throws TransactionTimeoutException if another lease for {@code sender} is still held when
     *                                     the deadline passes
     */
    public NonceLease reserve(final Address sender, final Deadline deadline) {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(deadline, "deadline");
        final Lane lane = lanes.computeIfAbsent(sender, ignored -> new Lane());
        synchronized (lane) {
            while (lane.inFlight != null) {
                final long waitMillis = deadline.remaining().toMillis();
                if (waitMillis <= 0) {
                    throw new TransactionTimeoutException(
                            "Timed out waiting for nonce " + lane.inFlight.nonce() + " of " + sender
                                    + " to reach a terminal state", null);
                }
                try {
                    lane.wait(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransactionTimeoutException("Interrupted while waiting for nonce lane of " + sender,
                            null);
                }
            }
            final long network = reader.getTransactionCount(sender, "pending");
            final long next = lane.floor == null ? network : Math.max(network, lane.floor);
            if (lane.floor != null && network < lane.floor) {
                LOG.debug("Node reports pending nonce {} for {} behind local floor {}", network, sender, lane.floor);
            }
            final NonceLease lease = new NonceLease(this, lane, sender, next);
            lane.inFlight = lease;
            DebugLogger.logTx(LogFormatter.formatNonce(sender.value(), next));
            return lease;
        }
    }

    /**
     * Forgets local state for {@code sender} after a nonce collision so the next reservation
     * trusts the network again. An outstanding lease is unaffected.
     */
    public void invalidate(final Address sender) {
        final Lane lane = lanes.get(sender);
        if (lane == null) {
            return;
        }
        synchronized (lane) {
            lane.floor = null;
        }
    }

    /**
     * Nonce currently leased for {@code sender}, if any.
     */
    public @Nullable Long inFlight(final Address sender) {
        final Lane lane = lanes.get(sender);
        if (lane == null) {
            return null;
        }
        synchronized (lane) {
            return lane.inFlight != null ? lane.inFlight.nonce() : null;
        }
    }

    /**
     * Drops every lane and wakes blocked reservations. Leases already handed out still release
     * cleanly but no longer affect later reservations.
     */
    public void clear() {
        for (Lane lane : lanes.values()) {
            synchronized (lane) {
                lane.inFlight = null;
                lane.floor = null;
                lane.notifyAll();
            }
        }
        lanes.clear();
    }

    void release(final NonceLease lease, final Outcome outcome) {
        final Lane lane = lease.lane();
        synchronized (lane) {
            if (lane.inFlight != lease) {
                return;
            }
            lane.inFlight = null;
            switch (outcome) {
                case CONFIRMED, OVERRIDDEN -> lane.floor = lane.floor == null
                        ? lease.nonce() + 1
                        : Math.max(lane.floor, lease.nonce() + 1);
                case FAILED -> lane.floor = null;
            }
            if (outcome == Outcome.OVERRIDDEN) {
                LOG.warn("Nonce {} of {} released without confirmation", lease.nonce(), lease.sender());
            }
            lane.notifyAll();
        }
    }

    static final class Lane {
        private @Nullable NonceLease inFlight;
        private @Nullable Long floor;
    }
}
