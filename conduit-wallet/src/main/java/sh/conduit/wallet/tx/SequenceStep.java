// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.util.Objects;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;

/**
 * One step of a dependent transaction flow such as create, approve, deposit.
 */
public sealed interface SequenceStep permits SequenceStep.Call, SequenceStep.External {

    String name();

    static Call call(final String name, final Address to, final HexData data) {
        return new Call(name, to, data, Wei.ZERO, TransactionHints.NONE);
    }

    /**
     * A transaction signed by the connected wallet.
     */
    record Call(String name, @Nullable Address to, HexData data, Wei value, TransactionHints hints)
            implements SequenceStep {

        public Call {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(data, "data");
            value = value != null ? value : Wei.ZERO;
            hints = hints != null ? hints : TransactionHints.NONE;
        }
    }

    /**
     * A transaction produced elsewhere, for example by a backend relayer. The supplier runs
     * only once the previous step is settled, and its hash is trusted as-is.
     */
    record External(String name, Supplier<Hash> hashSupplier) implements SequenceStep {

        public External {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(hashSupplier, "hashSupplier");
        }
    }
}
