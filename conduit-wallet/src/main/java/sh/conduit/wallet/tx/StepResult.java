// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Hash;

/**
 * @param nonce         sender nonce, or {@code null} for an external step
 * @param confirmedHash hash mined on chain; {@code null} when the step timed out
 */
public record StepResult(String name, @Nullable Long nonce, @Nullable Hash confirmedHash, TxStatus status) {

    public StepResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        if (status == TxStatus.CONFIRMED && confirmedHash == null) {
            throw new IllegalArgumentException("confirmed step " + name + " needs a hash");
        }
    }
}
