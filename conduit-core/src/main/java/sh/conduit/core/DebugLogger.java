// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trace output for RPC traffic and transaction lifecycles.
 * <p>
 * Messages are only formatted when the matching {@link ConduitDebug} switch is on, and every
 * message passes through {@link LogSanitizer} before it reaches the {@code sh.conduit.debug}
 * logger.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.conduit.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (ConduitDebug.isRpcLoggingEnabled()) {
            logDirect(message, args);
        }
    }

    public static void logTx(final String message, final Object... args) {
        if (ConduitDebug.isTxLoggingEnabled()) {
            logDirect(message, args);
        }
    }

    public static void log(final String message, final Object... args) {
        if (ConduitDebug.isEnabled()) {
            logDirect(message, args);
        }
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
