// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.ConduitException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.UserRejectedException;

/**
 * Re-classifies wallet-side JSON-RPC errors at the adapter boundary.
 */
public final class WalletErrors {

    private WalletErrors() {
    }

    /**
     * Maps code 4001 to {@link UserRejectedException} and missing-method errors to
     * {@link CapabilityMissingException}. Anything else is returned unchanged.
     */
    public static ConduitException classify(final RpcException e, final String method, final String providerName) {
        if (e.isUserRejection()) {
            return new UserRejectedException("User rejected " + method + " in " + providerName + " wallet", e);
        }
        if (e.isMethodMissing()) {
            return new CapabilityMissingException(method, providerName, e);
        }
        return e;
    }
}
