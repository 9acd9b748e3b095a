// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import sh.conduit.core.error.RpcException;

/**
 * Transparent retry for idempotent reads.
 * <p>
 * Only transport-level trouble is retried: network failures, unparseable responses, rate
 * limits and transient node errors. Reverts, user rejections and funding errors fail
 * immediately. Never use this for signing or broadcast calls.
 */
public final class RpcRetry {

    private RpcRetry() {
    }

    public static <T> T run(final Supplier<T> supplier, final RpcRetryConfig config) {
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");

        List<Throwable> failedAttempts = null;
        final long startTime = System.currentTimeMillis();

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                return supplier.get();
            } catch (RpcException e) {
                if (!isRetryableRpcError(e)) {
                    throw e;
                }
                failedAttempts = record(failedAttempts, e);
            } catch (RuntimeException e) {
                if (unwrapIo(e) == null) {
                    throw e;
                }
                failedAttempts = record(failedAttempts, e);
            }

            if (attempt == config.maxAttempts()) {
                break;
            }
            try {
                Thread.sleep(backoff(attempt, config));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                final RuntimeException last = lastOf(failedAttempts);
                last.addSuppressed(e);
                throw last;
            }
        }
        throw exhausted(failedAttempts, startTime);
    }

    static boolean isRetryableRpcError(final RpcException e) {
        if (e == null) {
            return false;
        }
        if (unwrapIo(e) != null || e.code() == -32700) {
            return true;
        }
        if (e.getMessage() == null || isLikelyRevert(e.data()) || e.isUserRejection()) {
            return false;
        }
        final String message = e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("insufficient funds") || message.contains("execution reverted")) {
            return false;
        }
        return message.contains("header not found")
                || message.contains("timeout")
                || message.contains("timed out")
                || message.contains("connection reset")
                || message.contains("temporary unavailable")
                || message.contains("try again")
                || message.contains("rate limit")
                || message.contains("too many requests")
                || message.contains(": 429")
                || message.contains(": 502")
                || message.contains(": 503")
                || message.contains(": 504")
                || message.contains("internal error")
                || message.contains("server busy")
                || message.contains("overloaded");
    }

    private static long backoff(final int attempt, final RpcRetryConfig config) {
        final long delay = config.backoffBaseMs() * (1L << Math.min(attempt - 1, 20));
        final long cappedDelay = Math.min(delay, config.backoffMaxMs());
        final double jitter = ThreadLocalRandom.current().nextDouble(config.jitterMin(), config.jitterMax());
        return cappedDelay + (long) (cappedDelay * jitter);
    }

    private static boolean isLikelyRevert(final String data) {
        return data != null && data.startsWith("0x") && data.length() > 10;
    }

    private static IOException unwrapIo(final Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof IOException io) {
                return io;
            }
            current = current.getCause();
        }
        return null;
    }

    private static List<Throwable> record(final List<Throwable> failures, final Throwable failure) {
        final List<Throwable> list = failures != null ? failures : new ArrayList<>();
        list.add(failure);
        return list;
    }

    private static RuntimeException lastOf(final List<Throwable> failures) {
        return (RuntimeException) failures.get(failures.size() - 1);
    }

    private static RetryExhaustedException exhausted(final List<Throwable> failures, final long startTime) {
        final RetryExhaustedException exhausted = new RetryExhaustedException(
                failures.size(), System.currentTimeMillis() - startTime, failures.get(failures.size() - 1));
        for (int i = 0; i < failures.size() - 1; i++) {
            exhausted.addSuppressed(failures.get(i));
        }
        return exhausted;
    }
}
