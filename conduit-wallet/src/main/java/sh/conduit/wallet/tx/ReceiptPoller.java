// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.TransactionRevertedException;
import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Hash;
import sh.conduit.rpc.ChainReader;

/**
 * Waits for the receipt of a hash that is already known to be correct, for example one produced
 * by the backend rather than the wallet.
 */
public final class ReceiptPoller {

    private static final Logger LOG = LoggerFactory.getLogger(ReceiptPoller.class);

    private final ChainReader reader;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public ReceiptPoller(final ChainReader reader, final RetryPolicy policy, final Sleeper sleeper) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @throws TransactionRevertedException if the receipt has status 0
     * @throws TransactionTimeoutException  if no receipt appeared within the deadline or policy;
     *                                      the transaction may still confirm later
     */
    public TransactionReceipt await(final Hash hash, final Deadline deadline) {
        final Deadline budget = Deadline.after(policy.totalBudget(), deadline.clock());
        for (int attempt = 1; attempt <= policy.maxAttempts() && !deadline.isExpired(); attempt++) {
            try {
                final TransactionReceipt receipt = reader.getTransactionReceipt(hash);
                if (receipt != null) {
                    DebugLogger.logTx(LogFormatter.formatTxReceipt(hash.value(), receipt.blockNumber(), receipt.status()));
                    if (!receipt.status()) {
                        throw new TransactionRevertedException(hash);
                    }
                    return receipt;
                }
            } catch (RpcException e) {
                LOG.warn("Receipt poll {} for {} failed: {}", attempt, hash, e.getMessage());
            }
            if (attempt == policy.maxAttempts() || budget.isExpired()) {
                break;
            }
            Polling.pause(sleeper, policy.delayFor(attempt), deadline.min(budget), hash);
        }
        throw new TransactionTimeoutException("No receipt for " + hash + " yet", hash);
    }
}
