// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.auth;

/**
 * Backend endpoints that turn a wallet proof into a session token.
 */
public interface BackendAuthClient {

    /**
     * Nonce returned instead of a challenge when the backend wants interactive signing skipped
     * and authentication deferred to the first authenticated call.
     */
    String LAZY_AUTH_NONCE = "SKIP_SIWX_LAZY_AUTH";

    /**
     * @throws sh.conduit.core.error.BackendAuthException if the backend did not issue a nonce
     */
    String fetchNonce();

    /**
     * @return the session token issued by the backend
     * @throws sh.conduit.core.error.SignatureVerificationException if the signature was rejected
     * @throws sh.conduit.core.error.BackendAuthException            for any other failure
     */
    String login(LoginRequest request);

    void logout(String token);
}
