// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.ErrorKind;
import sh.conduit.core.types.Address;
import sh.conduit.session.token.AuthToken;
import sh.conduit.wallet.ProviderKind;

/**
 * Snapshot of the wallet session. Never mutated; {@link SessionManager} replaces it wholesale
 * so no field of an earlier session can leak into a later one.
 */
public record Session(
        @Nullable ProviderKind providerKind,
        @Nullable Address address,
        boolean isConnected,
        boolean isAuthenticated,
        @Nullable AuthToken authToken,
        @Nullable ErrorKind lastError) {

    public static final Session EMPTY = new Session(null, null, false, false, null, null);

    public Session {
        if (isConnected && (providerKind == null || address == null)) {
            throw new IllegalArgumentException("a connected session needs a provider and an address");
        }
        if (isAuthenticated && (!isConnected || authToken == null)) {
            throw new IllegalArgumentException("an authenticated session needs a connection and a token");
        }
        if (!isConnected && (address != null || authToken != null)) {
            throw new IllegalArgumentException("a disconnected session carries no address or token");
        }
    }

    static Session connected(final ProviderKind kind, final Address address) {
        return new Session(kind, address, true, false, null, null);
    }

    static Session authenticated(final ProviderKind kind, final Address address, final AuthToken token) {
        return new Session(kind, address, true, true, token, null);
    }

    static Session failed(final ErrorKind error) {
        return new Session(null, null, false, false, null, error);
    }
}
