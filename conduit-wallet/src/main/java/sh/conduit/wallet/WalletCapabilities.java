// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import sh.conduit.core.error.CapabilityMissingException;

/**
 * Operations an adapter declares at construction time. Callers branch on this set rather than
 * probing the SDK.
 */
public final class WalletCapabilities {

    private final Set<WalletCapability> supported;

    private WalletCapabilities(final Set<WalletCapability> supported) {
        this.supported = Collections.unmodifiableSet(supported);
    }

    public static WalletCapabilities of(final WalletCapability first, final WalletCapability... rest) {
        return new WalletCapabilities(EnumSet.of(first, rest));
    }

    public static WalletCapabilities none() {
        return new WalletCapabilities(EnumSet.noneOf(WalletCapability.class));
    }

    public boolean supports(final WalletCapability capability) {
        return supported.contains(capability);
    }

    /**
     * @throws CapabilityMissingException if {@code capability} was not declared
     */
    public void require(final WalletCapability capability, final String providerName) {
        if (!supports(capability)) {
            throw new CapabilityMissingException(capability.name(), providerName);
        }
    }

    public Set<WalletCapability> asSet() {
        return supported;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof WalletCapabilities other && supported.equals(other.supported);
    }

    @Override
    public int hashCode() {
        return supported.hashCode();
    }

    @Override
    public String toString() {
        return "WalletCapabilities" + supported;
    }
}
