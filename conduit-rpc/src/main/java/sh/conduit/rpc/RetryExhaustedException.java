// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.RpcException;

/**
 * Every attempt of a retried read failed. The last failure is the cause; earlier ones are
 * attached as suppressed exceptions.
 */
public final class RetryExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attemptCount;
    private final long totalRetryDurationMs;

    public RetryExhaustedException(final int attemptCount, final long totalRetryDurationMs, final Throwable cause) {
        super(String.format("All %d retry attempts exhausted (total: %dms)", attemptCount, totalRetryDurationMs), cause);
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }

    public @Nullable RpcException rpcCause() {
        return getCause() instanceof RpcException rpc ? rpc : null;
    }
}
