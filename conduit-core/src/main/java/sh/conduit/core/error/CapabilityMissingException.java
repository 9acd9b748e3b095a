// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * The active wallet does not declare the capability an operation needs.
 */
public final class CapabilityMissingException extends WalletException {

    private final String capability;

    public CapabilityMissingException(final String capability, final String providerName) {
        super(ErrorKind.PROVIDER_CAPABILITY_MISSING,
                providerName + " wallet does not support " + capability);
        this.capability = capability;
    }

    public CapabilityMissingException(final String capability, final String providerName, final Throwable cause) {
        super(ErrorKind.PROVIDER_CAPABILITY_MISSING,
                providerName + " wallet does not support " + capability, cause);
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
