// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

/**
 * Progress callbacks for {@link TransactionSequenceRunner}. Invoked on the runner's thread.
 */
public interface SequenceListener {

    SequenceListener NONE = new SequenceListener() {
    };

    default void onStepDispatched(final int index, final String name, final PendingTransaction pending) {
    }

    default void onStepSettled(final int index, final StepResult result) {
    }
}
