// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.TransactionNotFoundException;
import sh.conduit.core.error.TransactionRevertedException;
import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.model.BlockSummary;
import sh.conduit.core.model.Transaction;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Hash;
import sh.conduit.rpc.ChainReader;

/**
 * Finds the hash a transaction was actually mined under.
 * <p>
 * Some wallets return a hash that belongs to an unrelated transaction. The wallet hash is only
 * accepted when the chain shows it mined from the expected sender with the expected nonce.
 * Otherwise recent blocks are walked newest first, never below the head observed at dispatch,
 * looking for a transaction whose {@code (from, nonce)} matches. Each round fetches at most
 * {@code blockWindow} blocks it has not already scanned, so later rounds pick up newly mined
 * blocks and older ones the first round did not reach.
 * <p>
 * The caller's deadline ends the search with {@link TransactionTimeoutException}; running out
 * of attempts or budget ends it with {@link TransactionNotFoundException}. The untrusted hash
 * is never returned unverified.
 */
public final class HashReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(HashReconciler.class);

    public static final int DEFAULT_BLOCK_WINDOW = 10;

    private final ChainReader reader;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final int blockWindow;

    public HashReconciler(final ChainReader reader, final RetryPolicy policy, final Sleeper sleeper,
            final int blockWindow) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        if (blockWindow < 1) {
            throw new IllegalArgumentException("blockWindow must be >= 1");
        }
        this.blockWindow = blockWindow;
    }

    public HashReconciler(final ChainReader reader, final RetryPolicy policy, final Sleeper sleeper) {
        this(reader, policy, sleeper, DEFAULT_BLOCK_WINDOW);
    }

    /**
     * @return the confirmed hash; {@code pending} is CONFIRMED on return
     * @throws TransactionRevertedException if the matching transaction mined with status 0
     * @throws TransactionTimeoutException  if the deadline passed first; {@code pending} is UNKNOWN
     * @throws TransactionNotFoundException if the retry policy ran out
     */
    public Hash reconcile(final PendingTransaction pending, final Deadline deadline) {
        Objects.requireNonNull(pending, "pending");
        final Deadline budget = Deadline.after(policy.totalBudget(), deadline.clock());
        final Search search = new Search(pending);

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (deadline.isExpired()) {
                throw timeout(pending);
            }
            try {
                final TransactionReceipt receipt = search.round(attempt);
                if (receipt != null) {
                    return finish(pending, receipt);
                }
            } catch (RpcException e) {
                LOG.warn("Reconcile round {} for {}#{} failed: {}",
                        attempt, pending.sender(), pending.nonce(), e.getMessage());
            }
            if (attempt == policy.maxAttempts() || budget.isExpired()) {
                break;
            }
            Polling.pause(sleeper, policy.delayFor(attempt), deadline.min(budget), pending.submittedHash());
        }
        if (deadline.isExpired()) {
            throw timeout(pending);
        }
        throw new TransactionNotFoundException(pending.sender(), pending.nonce(), search.rounds);
    }

    private Hash finish(final PendingTransaction pending, final TransactionReceipt receipt) {
        final Hash hash = receipt.transactionHash();
        DebugLogger.logTx(LogFormatter.formatTxReceipt(hash.value(), receipt.blockNumber(), receipt.status()));
        if (pending.submittedHash() != null && !hash.equals(pending.submittedHash())) {
            LOG.warn("Wallet returned {} for {}#{} but the chain mined {}",
                    pending.submittedHash(), pending.sender(), pending.nonce(), hash);
        }
        if (!receipt.status()) {
            pending.fail(hash);
            throw new TransactionRevertedException(hash);
        }
        pending.confirm(hash);
        return hash;
    }

    private static TransactionTimeoutException timeout(final PendingTransaction pending) {
        pending.markUnknown();
        return new TransactionTimeoutException(
                "Transaction " + pending.sender() + "#" + pending.nonce() + " still pending at deadline",
                pending.submittedHash());
    }

    private final class Search {

        private final PendingTransaction pending;
        private final Set<Long> scanned = new HashSet<>();
        private boolean decoyReported;
        private @Nullable Hash located;
        private int rounds;

        Search(final PendingTransaction pending) {
            this.pending = pending;
        }

        @Nullable TransactionReceipt round(final int attempt) {
            rounds = attempt;
            if (located == null) {
                located = locate(attempt);
            }
            if (located == null) {
                return null;
            }
            return reader.getTransactionReceipt(located);
        }

        private @Nullable Hash locate(final int attempt) {
            final Hash submitted = pending.submittedHash();
            final Transaction claimed = submitted != null ? reader.getTransactionByHash(submitted) : null;
            if (claimed != null) {
                if (claimed.matches(pending.sender(), pending.nonce())) {
                    if (claimed.isMined()) {
                        return claimed.hash();
                    }
                } else if (!decoyReported) {
                    decoyReported = true;
                    LOG.warn("Wallet hash {} belongs to {}#{}, expected {}#{}", submitted,
                            claimed.from(), claimed.nonce(), pending.sender(), pending.nonce());
                }
            }

            final long head = reader.blockNumber();
            final long lowest = Math.max(0L, pending.submittedAtBlock());
            long oldestFetched = head;
            int fetched = 0;
            for (long number = head; number >= lowest && fetched < blockWindow; number--) {
                if (scanned.contains(number)) {
                    continue;
                }
                final BlockSummary block = reader.getBlockByNumber(number);
                fetched++;
                oldestFetched = number;
                if (block == null) {
                    continue;
                }
                for (Hash hash : block.transactionHashes()) {
                    final Transaction tx = reader.getTransactionByHash(hash);
                    if (tx != null && tx.matches(pending.sender(), pending.nonce())) {
                        return tx.hash();
                    }
                }
                scanned.add(number);
            }
            DebugLogger.logTx(LogFormatter.formatReconcile(
                    pending.sender().value(), pending.nonce(), attempt, oldestFetched, head));
            return null;
        }
    }
}
