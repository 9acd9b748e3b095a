// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.auth;

import java.net.URI;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import sh.conduit.core.types.Address;

/**
 * EIP-4361 sign-in message.
 *
 * @param domain   host requesting the signature, e.g. {@code app.conduit.sh}
 * @param address  account signing in
 * @param statement human readable line shown in the wallet prompt
 * @param uri      origin of the request
 * @param chainId  chain the session is bound to
 * @param nonce    backend-issued challenge
 * @param issuedAt creation time, rendered in ISO-8601 with millisecond precision
 */
public record SignInMessage(
        String domain,
        Address address,
        String statement,
        URI uri,
        long chainId,
        String nonce,
        Instant issuedAt) {

    public static final String DEFAULT_STATEMENT = "Sign in to Conduit";

    private static final DateTimeFormatter ISSUED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    public SignInMessage {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(issuedAt, "issuedAt");
        if (nonce.length() < 8 || !nonce.chars().allMatch(Character::isLetterOrDigit)) {
            throw new IllegalArgumentException("nonce must be at least 8 alphanumeric characters");
        }
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive");
        }
    }

    public String render() {
        return domain + " wants you to sign in with your Ethereum account:\n"
                + address.value() + "\n"
                + "\n"
                + statement + "\n"
                + "\n"
                + "URI: " + uri + "\n"
                + "Version: 1\n"
                + "Chain ID: " + chainId + "\n"
                + "Nonce: " + nonce + "\n"
                + "Issued At: " + ISSUED_AT.format(issuedAt);
    }
}
