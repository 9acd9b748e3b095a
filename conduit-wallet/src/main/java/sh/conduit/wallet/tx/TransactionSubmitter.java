// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.NonceCollisionException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.TransactionNotFoundException;
import sh.conduit.core.error.TransactionRevertedException;
import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.tx.SignedTransaction;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;
import sh.conduit.rpc.ChainReader;
import sh.conduit.wallet.HybridRpcRouter;
import sh.conduit.wallet.WalletCapability;
import sh.conduit.wallet.WalletProviderAdapter;

/**
 * Prepares, signs and dispatches transactions for the connected wallet, then confirms them.
 * <p>
 * Every request carries an explicit nonce from the {@link NonceSequencer}, a gas limit from the
 * hint or a buffered estimate, and a gas price from the trusted endpoint. Only nonce collisions
 * are retried; a user rejection is final. An "already known" reply means the transaction was
 * accepted and is never resent. The hash the wallet returns is handed to the
 * {@link HashReconciler} and never reported as confirmed on its own.
 * <p>
 * This class is thread-safe. Dispatches for the same sender are serialized by the sequencer.
 */
public final class TransactionSubmitter {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionSubmitter.class);

    private final HybridRpcRouter router;
    private final NonceSequencer nonces;
    private final GasPolicy gasPolicy;
    private final HashReconciler reconciler;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Map<PendingTransaction, NonceLease> leases = new ConcurrentHashMap<>();

    public TransactionSubmitter(
            final HybridRpcRouter router,
            final NonceSequencer nonces,
            final GasPolicy gasPolicy,
            final HashReconciler reconciler,
            final RetryPolicy retryPolicy,
            final Sleeper sleeper) {
        this.router = Objects.requireNonNull(router, "router");
        this.nonces = Objects.requireNonNull(nonces, "nonces");
        this.gasPolicy = Objects.requireNonNull(gasPolicy, "gasPolicy");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Dispatches and waits for the confirmed hash.
     */
    public Hash submit(
            final @Nullable Address to,
            final HexData data,
            final Wei value,
            final TransactionHints hints,
            final Deadline deadline) {
        return awaitConfirmation(dispatch(to, data, value, hints, deadline), deadline);
    }

    /**
     * Reserves a nonce, prepares gas and hands the transaction to the wallet. The nonce lease
     * stays held until {@link #awaitConfirmation} or {@link #abandon} settles it.
     */
    public PendingTransaction dispatch(
            final @Nullable Address to,
            final HexData data,
            final Wei value,
            final TransactionHints hints,
            final Deadline deadline) {
        final WalletProviderAdapter wallet = router.wallet();
        final Address sender = wallet.getAddress();
        final TransactionHints safeHints = hints != null ? hints : TransactionHints.NONE;

        for (int attempt = 1; ; attempt++) {
            final NonceLease lease = nonces.reserve(sender, deadline);
            try {
                final TransactionRequest prepared = prepare(sender, to, data, value, safeHints, lease.nonce());
                final long head = router.reader().blockNumber();
                final Hash claimed = send(wallet, prepared);
                final PendingTransaction pending = new PendingTransaction(sender, lease.nonce(), claimed, head);
                leases.put(pending, lease);
                return pending;
            } catch (RpcException e) {
                lease.fail();
                if (!e.isNonceCollision()) {
                    throw e;
                }
                nonces.invalidate(sender);
                if (attempt >= retryPolicy.maxAttempts() || deadline.isExpired()) {
                    throw new NonceCollisionException(sender, lease.nonce(), e);
                }
                LOG.info("Nonce {} of {} already used, retrying with a fresh nonce", lease.nonce(), sender);
                Polling.pause(sleeper, retryPolicy.delayFor(attempt), deadline, null);
            } catch (RuntimeException e) {
                lease.fail();
                throw e;
            }
        }
    }

    /**
     * Waits for the chain to confirm {@code pending} and settles its nonce lease.
     * <p>
     * On timeout the lease stays held: the transaction may still mine, and the caller can wait
     * again or {@link #abandon} it.
     */
    public Hash awaitConfirmation(final PendingTransaction pending, final Deadline deadline) {
        final NonceLease lease = leases.get(pending);
        try {
            final Hash hash = reconciler.reconcile(pending, deadline);
            settle(pending, lease, true);
            return hash;
        } catch (TransactionRevertedException e) {
            settle(pending, lease, true);
            throw e;
        } catch (TransactionNotFoundException e) {
            settle(pending, lease, false);
            throw e;
        } catch (TransactionTimeoutException e) {
            LOG.info("{}#{} still pending; nonce lease kept", pending.sender(), pending.nonce());
            throw e;
        }
    }

    /**
     * Stops waiting on a timed-out transaction and lets the sender's next nonce be issued.
     *
     * @return false if the transaction was already settled
     */
    public boolean abandon(final PendingTransaction pending) {
        final NonceLease lease = leases.remove(pending);
        return lease != null && lease.override();
    }

    public ChainReader reader() {
        return router.reader();
    }

    /** Address every transaction from this submitter is sent from. */
    public Address sender() {
        return router.wallet().getAddress();
    }

    /**
     * Drops held leases and sequencer state. Called when the session that owns this submitter
     * ends.
     */
    public void reset() {
        leases.clear();
        nonces.clear();
    }

    TransactionRequest prepare(
            final Address sender,
            final @Nullable Address to,
            final HexData data,
            final Wei value,
            final TransactionHints hints,
            final long nonce) {
        final ChainReader reader = router.reader();
        final TransactionRequest unprepared = new TransactionRequest(sender, to, value, data, null, null, nonce);
        final long estimate = hints.gasLimit() != null ? 0L : reader.estimateGas(unprepared);
        final long gasLimit = gasPolicy.resolveGasLimit(hints.gasLimit(), estimate, unprepared.data());
        final Wei networkPrice = reader.gasPrice();
        final Wei gasPrice = gasPolicy.resolvePrice(networkPrice, hints.gasPrice());
        gasPolicy.checkCost(gasLimit, gasPrice);
        DebugLogger.logTx(LogFormatter.formatGas(gasLimit, gasPrice, networkPrice));
        return unprepared.withGas(gasLimit, gasPrice);
    }

    private @Nullable Hash send(final WalletProviderAdapter wallet, final TransactionRequest prepared) {
        DebugLogger.logTx(LogFormatter.formatTxSend(
                prepared.from().value(),
                prepared.to() != null ? prepared.to().value() : "create",
                prepared.nonce(),
                prepared.gasLimit(),
                prepared.value()));
        final long start = System.nanoTime();
        final Hash hash;
        if (wallet.capabilities().supports(WalletCapability.SEND_TRANSACTION)) {
            try {
                hash = wallet.sendTransaction(prepared);
            } catch (RpcException e) {
                if (!e.isAlreadyKnown()) {
                    throw e;
                }
                // accepted earlier under this nonce; the reconciler finds it by sender and nonce
                LOG.info("Wallet already holds {}#{}; awaiting it instead of resending",
                        prepared.from(), prepared.nonce());
                return null;
            }
        } else if (wallet.capabilities().supports(WalletCapability.SIGN_TRANSACTION)) {
            final SignedTransaction signed = wallet.signTransaction(prepared);
            try {
                router.request("eth_sendRawTransaction", List.of(signed.raw().value()));
            } catch (RpcException e) {
                if (!e.isAlreadyKnown()) {
                    throw e;
                }
                LOG.info("Node already holds {}; treating broadcast as accepted", signed.hash());
            }
            hash = signed.hash();
        } else {
            throw new CapabilityMissingException(WalletCapability.SEND_TRANSACTION.name(), wallet.name());
        }
        DebugLogger.logTx(LogFormatter.formatTxHash(hash.value(), (System.nanoTime() - start) / 1_000L));
        return hash;
    }

    private void settle(final PendingTransaction pending, final @Nullable NonceLease lease, final boolean mined) {
        leases.remove(pending);
        if (lease == null) {
            return;
        }
        if (mined) {
            lease.confirm();
        } else {
            lease.fail();
        }
    }
}
