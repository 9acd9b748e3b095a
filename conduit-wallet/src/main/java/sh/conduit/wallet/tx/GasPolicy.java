// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.GasPriceExceededException;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;

/**
 * Gas limit and gas price rules.
 * <p>
 * The price always starts from the trusted endpoint's {@code eth_gasPrice}. It is raised by
 * {@code priceBufferPercent} and clamped into {@code [floor, ceiling]}, but a network price
 * above the ceiling is an error rather than a clamp: paying less than the network asks leaves
 * the transaction stuck.
 *
 * @param floor                 minimum price paid
 * @param ceiling               maximum price paid
 * @param priceBufferPercent    extra over the network price, e.g. 10 for +10%
 * @param gasLimitMarginPercent extra over {@code eth_estimateGas}, e.g. 20 for +20%
 * @param maxGasCost            optional cap on {@code gasLimit * gasPrice}
 * @param selectorGasCaps       measured gas usage keyed by lowercase 4-byte selector
 * @param capMultiplierPercent  headroom over a selector cap, e.g. 110 for 1.1x
 */
public record GasPolicy(
        Wei floor,
        Wei ceiling,
        int priceBufferPercent,
        int gasLimitMarginPercent,
        @Nullable Wei maxGasCost,
        Map<String, Long> selectorGasCaps,
        int capMultiplierPercent) {

    public static final int DEFAULT_GAS_LIMIT_MARGIN_PERCENT = 20;
    public static final int DEFAULT_PRICE_BUFFER_PERCENT = 10;
    public static final int DEFAULT_CAP_MULTIPLIER_PERCENT = 110;

    public GasPolicy {
        Objects.requireNonNull(floor, "floor");
        Objects.requireNonNull(ceiling, "ceiling");
        if (ceiling.compareTo(floor) < 0) {
            throw new IllegalArgumentException("ceiling " + ceiling + " is below floor " + floor);
        }
        if (priceBufferPercent < 0 || gasLimitMarginPercent < 0) {
            throw new IllegalArgumentException("buffers must not be negative");
        }
        if (capMultiplierPercent < 100) {
            throw new IllegalArgumentException("capMultiplierPercent must be >= 100");
        }
        final Map<String, Long> caps = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : Objects.requireNonNull(selectorGasCaps, "selectorGasCaps").entrySet()) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException("gas cap for " + entry.getKey() + " must be positive");
            }
            caps.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        selectorGasCaps = Map.copyOf(caps);
    }

    /**
     * Price to pay given the trusted network price and an optional caller hint.
     *
     * @throws GasPriceExceededException if the network price is above the ceiling
     */
    public Wei resolvePrice(final Wei networkPrice, final @Nullable Wei hint) {
        if (networkPrice.compareTo(ceiling) > 0) {
            throw GasPriceExceededException.price(networkPrice, ceiling);
        }
        final Wei base = hint != null ? Wei.max(hint, networkPrice) : networkPrice.percentOf(100L + priceBufferPercent);
        return Wei.max(floor, Wei.min(base, ceiling));
    }

    /**
     * Gas limit from the hint, or the estimate plus margin, then capped by the selector table.
     */
    public long resolveGasLimit(final @Nullable Long hint, final long estimate, final HexData data) {
        final long limit = hint != null ? hint : Math.addExact(estimate, estimate * gasLimitMarginPercent / 100);
        final Long cap = capFor(data);
        if (cap == null) {
            return limit;
        }
        return Math.min(limit, cap * capMultiplierPercent / 100);
    }

    /**
     * @throws GasPriceExceededException if {@code gasLimit * price} exceeds {@link #maxGasCost()}
     */
    public void checkCost(final long gasLimit, final Wei price) {
        if (maxGasCost == null) {
            return;
        }
        final Wei cost = new Wei(price.value().multiply(BigInteger.valueOf(gasLimit)));
        if (cost.compareTo(maxGasCost) > 0) {
            throw GasPriceExceededException.cost(cost, maxGasCost);
        }
    }

    private @Nullable Long capFor(final HexData data) {
        final String selector = data.selector();
        return selector == null ? null : selectorGasCaps.get(selector);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Wei floor = Wei.of(1);
        private Wei ceiling = Wei.gwei(100);
        private int priceBufferPercent = DEFAULT_PRICE_BUFFER_PERCENT;
        private int gasLimitMarginPercent = DEFAULT_GAS_LIMIT_MARGIN_PERCENT;
        private @Nullable Wei maxGasCost;
        private final Map<String, Long> selectorGasCaps = new LinkedHashMap<>();
        private int capMultiplierPercent = DEFAULT_CAP_MULTIPLIER_PERCENT;

        private Builder() {
        }

        public Builder floor(final Wei floor) {
            this.floor = floor;
            return this;
        }

        public Builder ceiling(final Wei ceiling) {
            this.ceiling = ceiling;
            return this;
        }

        public Builder priceBufferPercent(final int priceBufferPercent) {
            this.priceBufferPercent = priceBufferPercent;
            return this;
        }

        public Builder gasLimitMarginPercent(final int gasLimitMarginPercent) {
            this.gasLimitMarginPercent = gasLimitMarginPercent;
            return this;
        }

        public Builder maxGasCost(final @Nullable Wei maxGasCost) {
            this.maxGasCost = maxGasCost;
            return this;
        }

        public Builder selectorGasCap(final String selector, final long gas) {
            this.selectorGasCaps.put(selector, gas);
            return this;
        }

        public Builder capMultiplierPercent(final int capMultiplierPercent) {
            this.capMultiplierPercent = capMultiplierPercent;
            return this;
        }

        public GasPolicy build() {
            return new GasPolicy(floor, ceiling, priceBufferPercent, gasLimitMarginPercent, maxGasCost,
                    selectorGasCaps, capMultiplierPercent);
        }
    }
}
