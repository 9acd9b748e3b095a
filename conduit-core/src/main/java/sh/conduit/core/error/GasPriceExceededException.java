// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import sh.conduit.core.types.Wei;

/**
 * The network requires more than the configured ceiling. The price is never clamped below the
 * network's requirement, since such a transaction would sit in the mempool indefinitely.
 */
public final class GasPriceExceededException extends TxnException {

    private final Wei required;
    private final Wei ceiling;

    public GasPriceExceededException(final String message, final Wei required, final Wei ceiling) {
        super(ErrorKind.GAS_PRICE_EXCEEDED, message);
        this.required = required;
        this.ceiling = ceiling;
    }

    public static GasPriceExceededException price(final Wei networkPrice, final Wei ceiling) {
        return new GasPriceExceededException(
                "Network gas price " + networkPrice.toGwei().toPlainString() + " gwei exceeds the configured maximum of "
                        + ceiling.toGwei().toPlainString() + " gwei; retry when the network is less busy",
                networkPrice, ceiling);
    }

    public static GasPriceExceededException cost(final Wei cost, final Wei maxCost) {
        return new GasPriceExceededException(
                "Transaction would cost up to " + cost.toGwei().toPlainString() + " gwei in gas, above the configured maximum of "
                        + maxCost.toGwei().toPlainString() + " gwei",
                cost, maxCost);
    }

    public Wei required() {
        return required;
    }

    public Wei ceiling() {
        return ceiling;
    }
}
