// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

public enum TxStatus {
    SUBMITTED,
    CONFIRMED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }
}
