// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Classification of failures surfaced to the session layer and callers.
 * <p>
 * Provider and RPC errors are mapped onto one of these kinds at the component boundary, so
 * the session layer never has to inspect provider-specific messages.
 */
public enum ErrorKind {
    NOT_CONNECTED,
    PROVIDER_CAPABILITY_MISSING,
    /** The user declined a prompt. Never retried. */
    USER_REJECTED,
    /** The nonce was already used or is queued. Retried after re-reading the next nonce. */
    NONCE_COLLISION,
    GAS_PRICE_EXCEEDED,
    /** A caller deadline elapsed while waiting. The transaction may still confirm later. */
    TRANSACTION_TIMEOUT,
    TRANSACTION_NOT_FOUND,
    TRANSACTION_REVERTED,
    CHAIN_MISMATCH,
    BACKEND_AUTH_FAILED,
    SIGNATURE_VERIFICATION_FAILED,
    RPC_FAILURE
}
