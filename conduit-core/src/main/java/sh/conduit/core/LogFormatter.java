// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

import static sh.conduit.core.AnsiColors.*;

/**
 * Single-line renderings of RPC and transaction events for {@link DebugLogger}.
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    public static String formatRpc(String method, String route, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s route=%s %s",
                INDIGO, RESET,
                method, route,
                duration(durationMicros));
    }

    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    public static String formatGas(Object gasLimit, Object gasPrice, Object networkPrice) {
        return String.format(
                "%s[GAS]%s gasLimit=%s gasPrice=%s networkPrice=%s",
                AMBER, RESET,
                gasLimit, gasPrice, networkPrice);
    }

    public static String formatNonce(String sender, long nonce) {
        return String.format(
                "%s[NONCE]%s sender=%s nonce=%d",
                AMBER, RESET,
                shortenHash(sender), nonce);
    }

    public static String formatTxSend(String from, String to, Object nonce, Object gasLimit, Object value) {
        return String.format(
                "%s[TX-SEND]%s from=%s to=%s nonce=%s gasLimit=%s value=%s",
                LAVENDER, RESET,
                shortenHash(String.valueOf(from)),
                to != null ? shortenHash(to) : "null",
                nonce, gasLimit, value);
    }

    public static String formatTxHash(String hash, long durationMicros) {
        return String.format(
                "%s[TX-HASH]%s hash=%s %s",
                LAVENDER, RESET,
                shortenHash(hash),
                duration(durationMicros));
    }

    public static String formatReconcile(String sender, long nonce, int attempt, long fromBlock, long toBlock) {
        return String.format(
                "%s○%s %s[RECONCILE]%s sender=%s nonce=%d attempt=%d blocks=%d..%d",
                SLATE, RESET,
                LAVENDER, RESET,
                shortenHash(sender), nonce, attempt, fromBlock, toBlock);
    }

    public static String formatTxReceipt(String hash, Object block, boolean status) {
        final String color = status ? TEAL : CORAL;
        return String.format(
                "%s%s%s %s[TX-RECEIPT]%s hash=%s block=%s status=%s%s%s",
                color, status ? "✓" : "✗", RESET,
                color, RESET,
                shortenHash(hash),
                block,
                color, status ? "SUCCESS" : "FAILED", RESET);
    }

    private static String duration(long micros) {
        final double ms = micros / 1000.0;
        final String formatted = ms < 1000 ? String.format("%.2fms", ms) : String.format("%.2fs", ms / 1000.0);
        return SLATE + "duration=" + formatted + RESET;
    }

    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
