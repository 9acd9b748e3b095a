// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

/**
 * Global switches for verbose RPC and transaction tracing through {@link DebugLogger}.
 * <p>
 * Both are off by default. The system properties {@code conduit.debug.rpc} and
 * {@code conduit.debug.tx} turn them on at startup.
 */
public final class ConduitDebug {

    private static volatile boolean rpcLogging = Boolean.getBoolean("conduit.debug.rpc");
    private static volatile boolean txLogging = Boolean.getBoolean("conduit.debug.tx");

    private ConduitDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
