// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

/**
 * Restore status reported by an adapter.
 * <p>
 * {@link #NOT_READY} means the SDK has not finished its asynchronous restore and the answer
 * may still change. {@link #READY_DISCONNECTED} is authoritative.
 */
public enum ProviderReadiness {
    READY_CONNECTED,
    READY_DISCONNECTED,
    NOT_READY
}
