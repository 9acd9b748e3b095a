// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Format checks and claim decoding for backend tokens.
 */
public final class AuthTokens {

    private static final Logger LOG = LoggerFactory.getLogger(AuthTokens.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> CLAIMS = new TypeReference<>() {
    };
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/_-]+={0,2}$");
    private static final int MIN_LENGTH = 10;

    private AuthTokens() {
    }

    /**
     * Loose shape check applied before a stored token is trusted: at least ten characters and
     * either JWT-like, base64, or a {@code wallet:} / {@code social:} token.
     */
    public static boolean isValidFormat(final String token) {
        if (token == null || token.length() < MIN_LENGTH) {
            return false;
        }
        if (token.contains(".") || BASE64.matcher(token).matches()) {
            return true;
        }
        return token.startsWith("wallet:") || token.startsWith("social:");
    }

    /**
     * Payload claims of a JWT, or an empty map if the token is not a decodable JWT.
     */
    public static Map<String, Object> decodeClaims(final String token) {
        if (token == null) {
            return Map.of();
        }
        final String[] parts = token.split("\\.");
        if (parts.length != 3) {
            return Map.of();
        }
        try {
            final byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            return MAPPER.readValue(new String(payload, StandardCharsets.UTF_8), CLAIMS);
        } catch (IllegalArgumentException | IOException e) {
            LOG.debug("Token payload is not JSON: {}", e.getMessage());
            return Map.of();
        }
    }
}
