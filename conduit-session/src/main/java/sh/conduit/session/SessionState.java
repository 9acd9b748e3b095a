// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

/**
 * Lifecycle of a {@link SessionManager}.
 */
public enum SessionState {
    UNINITIALIZED,
    INITIALIZING,
    RESTORING_SESSION,
    DISCONNECTED,
    CONNECTING,
    CONNECTED_UNAUTHENTICATED,
    AUTHENTICATED,
    ERROR;

    /**
     * True while a restore or connect is in flight.
     */
    public boolean isTransitioning() {
        return this == INITIALIZING || this == RESTORING_SESSION || this == CONNECTING;
    }

    public boolean hasWallet() {
        return this == CONNECTED_UNAUTHENTICATED || this == AUTHENTICATED;
    }
}
