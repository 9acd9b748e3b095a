// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

public final class ChainMismatchException extends TxnException {

    private final long expected;
    private final long actual;

    public ChainMismatchException(final long expected, final long actual) {
        super(ErrorKind.CHAIN_MISMATCH, "Chain ID mismatch: expected " + expected + " but connected to " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public ChainMismatchException(final long expected, final long actual, final Throwable cause) {
        super(ErrorKind.CHAIN_MISMATCH,
                "Wallet is on chain " + actual + " and could not switch to chain " + expected, cause);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
