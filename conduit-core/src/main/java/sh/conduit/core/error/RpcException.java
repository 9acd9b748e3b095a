// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC or transport failure.
 * <p>
 * Codes follow JSON-RPC 2.0 and EIP-1193: {@code -32000} for network failures raised by the
 * transport, {@code -32700} for unparseable payloads, {@code 4001} for user rejection and
 * {@code -32601} for unknown methods.
 */
public final class RpcException extends ConduitException {

    public static final int USER_REJECTED_CODE = 4001;
    public static final int UNSUPPORTED_METHOD_CODE = 4200;
    public static final int METHOD_NOT_FOUND_CODE = -32601;
    public static final int NETWORK_ERROR_CODE = -32000;

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(ErrorKind.RPC_FAILURE, augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public RpcException(final int code, final String message) {
        this(code, message, null, null, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    public boolean isUserRejection() {
        return code == USER_REJECTED_CODE || messageContains("user rejected") || messageContains("user denied");
    }

    public boolean isMethodMissing() {
        return code == METHOD_NOT_FOUND_CODE
                || code == UNSUPPORTED_METHOD_CODE
                || messageContains("method not found")
                || messageContains("not supported")
                || messageContains("does not exist");
    }

    /**
     * True for errors meaning the nonce slot is taken by a different transaction: already mined,
     * or queued with a competing transaction.
     */
    public boolean isNonceCollision() {
        return !isAlreadyKnown()
                && (messageContains("nonce too low")
                || messageContains("replacement transaction underpriced")
                || messageContains("nonce has already been used"));
    }

    /**
     * True when the node already holds this exact transaction. The broadcast took effect.
     */
    public boolean isAlreadyKnown() {
        return messageContains("already known")
                || messageContains("known transaction")
                || messageContains("already imported");
    }

    private boolean messageContains(final String needle) {
        final String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + ", data=" + data
                + ", requestId=" + requestId + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
