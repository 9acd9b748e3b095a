// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-negative amount of wei. Serialized as a JSON-RPC quantity.
 */
public record Wei(BigInteger value) implements Comparable<Wei> {
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger WEI_PER_GWEI = BigInteger.valueOf(1_000_000_000L);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(WEI_PER_GWEI));
    }

    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    public BigDecimal toGwei() {
        return new BigDecimal(value).divide(new BigDecimal(WEI_PER_GWEI), 9, RoundingMode.DOWN);
    }

    /**
     * Scales this amount by {@code percent / 100}, rounding down.
     */
    public Wei percentOf(final long percent) {
        return new Wei(value.multiply(BigInteger.valueOf(percent)).divide(BigInteger.valueOf(100)));
    }

    public Wei multiply(final long factor) {
        return new Wei(value.multiply(BigInteger.valueOf(factor)));
    }

    public static Wei max(final Wei a, final Wei b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Wei min(final Wei a, final Wei b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
