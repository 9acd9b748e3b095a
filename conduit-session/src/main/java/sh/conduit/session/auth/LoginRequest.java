// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.auth;

import java.util.Objects;

import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;

/**
 * Proof presented to the backend in exchange for a session token.
 */
public sealed interface LoginRequest permits LoginRequest.SignedMessage, LoginRequest.Token {

    /**
     * A signed sign-in message, verified by {@code POST /api/auth/verify}.
     */
    record SignedMessage(String message, HexData signature) implements LoginRequest {

        public SignedMessage {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(signature, "signature");
        }
    }

    /**
     * A token issued by a social-login provider, exchanged by {@code POST /api/auth/login}.
     */
    record Token(String token, Address walletAddress) implements LoginRequest {

        public Token {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(walletAddress, "walletAddress");
        }

        @Override
        public String toString() {
            return "Token[walletAddress=" + walletAddress + "]";
        }
    }
}
