// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

import java.util.regex.Pattern;

/**
 * Redacts credentials and signing material from log lines and caps their length.
 * <p>
 * Covered: private keys, raw signed transactions, signatures, bearer tokens and
 * {@code "token"} JSON fields.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;
    private static final String TRUNCATION_SUFFIX = "...(truncated)";
    private static final String REDACTED = "***[REDACTED]***";

    private static final Pattern PRIVATE_KEY_PATTERN = jsonField("privateKey");
    private static final Pattern RAW_PATTERN = jsonField("raw");
    private static final Pattern SIGNATURE_PATTERN = jsonField("signature");
    private static final Pattern TOKEN_PATTERN = jsonField("token");
    private static final Pattern BEARER_PATTERN = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        sanitized = redactField(sanitized, "privateKey", PRIVATE_KEY_PATTERN);
        sanitized = redactField(sanitized, "raw", RAW_PATTERN);
        sanitized = redactField(sanitized, "signature", SIGNATURE_PATTERN);
        sanitized = redactField(sanitized, "token", TOKEN_PATTERN);
        if (containsIgnoreCase(sanitized, "bearer")) {
            sanitized = BEARER_PATTERN.matcher(sanitized).replaceAll("Bearer " + REDACTED);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }

    private static String redactField(final String input, final String field, final Pattern pattern) {
        if (!input.contains("\"" + field + "\"")) {
            return input;
        }
        return pattern.matcher(input).replaceAll("\"" + field + "\":\"" + REDACTED + "\"");
    }

    private static Pattern jsonField(final String field) {
        return Pattern.compile("\"" + field + "\"\\s*:\\s*\"[^\"]+\"");
    }

    private static boolean containsIgnoreCase(final String haystack, final String needle) {
        return haystack.toLowerCase(java.util.Locale.ROOT).contains(needle);
    }
}
