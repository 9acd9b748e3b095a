// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

/**
 * Family of wallet SDK behind an adapter.
 */
public enum ProviderKind {
    /** Browser-extension style wallet; the address is returned directly. */
    INJECTED,
    /** Social-login backed account; may sign without user prompts. */
    EMBEDDED,
    /** Wallet-connect style remote signer; the address arrives as an event. */
    REMOTE_RELAY
}
