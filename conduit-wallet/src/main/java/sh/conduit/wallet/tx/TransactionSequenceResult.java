// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.conduit.core.types.Address;

/**
 * Ordered outcome of a multi-step flow. Wallet-signed steps carry strictly increasing nonces.
 */
public record TransactionSequenceResult(Address sender, List<StepResult> steps) {

    public TransactionSequenceResult {
        Objects.requireNonNull(sender, "sender");
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        Long previous = null;
        for (StepResult step : steps) {
            if (step.nonce() == null) {
                continue;
            }
            if (previous != null && step.nonce() <= previous) {
                throw new IllegalArgumentException("step " + step.name() + " has nonce " + step.nonce()
                        + " not above previous nonce " + previous);
            }
            previous = step.nonce();
        }
    }

    public boolean allConfirmed() {
        return steps.stream().allMatch(step -> step.status() == TxStatus.CONFIRMED);
    }

    public Optional<StepResult> step(final String name) {
        return steps.stream().filter(step -> step.name().equals(name)).findFirst();
    }
}
