// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * Runs dependent steps one after another. Step N is dispatched only after step N-1 is confirmed,
 * or after its per-step timeout when {@code proceedOnTimeout} is set; in that case the timed-out
 * step's nonce lease is overridden and the step is reported as UNKNOWN.
 * <p>
 * A revert, a transaction that cannot be found, or any other failure aborts the run.
 */
public final class TransactionSequenceRunner {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionSequenceRunner.class);

    private final TransactionSubmitter submitter;
    private final ReceiptPoller receiptPoller;
    private final Clock clock;
    private final boolean proceedOnTimeout;

    public TransactionSequenceRunner(
            final TransactionSubmitter submitter,
            final ReceiptPoller receiptPoller,
            final Clock clock,
            final boolean proceedOnTimeout) {
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.receiptPoller = Objects.requireNonNull(receiptPoller, "receiptPoller");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.proceedOnTimeout = proceedOnTimeout;
    }

    /**
     * @param sender the submitting wallet's address; results are attributed to it
     * @throws IllegalArgumentException if {@code sender} is not the wallet the submitter sends from
     */
    public TransactionSequenceResult run(
            final Address sender,
            final List<? extends SequenceStep> steps,
            final Duration perStepTimeout,
            final SequenceListener listener) {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(steps, "steps");
        final Address wallet = submitter.sender();
        if (!wallet.equals(sender)) {
            throw new IllegalArgumentException("Sequence sender " + sender + " is not the submitting wallet " + wallet);
        }
        final SequenceListener events = listener != null ? listener : SequenceListener.NONE;
        final List<StepResult> results = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            final SequenceStep step = steps.get(i);
            final Deadline deadline = Deadline.after(perStepTimeout, clock);
            final StepResult result;
            if (step instanceof SequenceStep.Call call) {
                result = runCall(i, call, deadline, events);
            } else {
                result = runExternal((SequenceStep.External) step, deadline);
            }
            results.add(result);
            events.onStepSettled(i, result);
        }
        return new TransactionSequenceResult(sender, results);
    }

    private StepResult runCall(
            final int index, final SequenceStep.Call call, final Deadline deadline, final SequenceListener events) {
        final PendingTransaction pending =
                submitter.dispatch(call.to(), call.data(), call.value(), call.hints(), deadline);
        events.onStepDispatched(index, call.name(), pending);
        try {
            final Hash hash = submitter.awaitConfirmation(pending, deadline);
            return new StepResult(call.name(), pending.nonce(), hash, TxStatus.CONFIRMED);
        } catch (TransactionTimeoutException e) {
            if (!proceedOnTimeout) {
                throw e;
            }
            submitter.abandon(pending);
            LOG.warn("Step {} timed out at nonce {}; continuing", call.name(), pending.nonce());
            return new StepResult(call.name(), pending.nonce(), null, TxStatus.UNKNOWN);
        }
    }

    private StepResult runExternal(final SequenceStep.External external, final Deadline deadline) {
        final Hash hash = external.hashSupplier().get();
        try {
            receiptPoller.await(hash, deadline);
            return new StepResult(external.name(), null, hash, TxStatus.CONFIRMED);
        } catch (TransactionTimeoutException e) {
            if (!proceedOnTimeout) {
                throw e;
            }
            LOG.warn("External step {} ({}) timed out; continuing", external.name(), hash);
            return new StepResult(external.name(), null, null, TxStatus.UNKNOWN);
        }
    }
}
