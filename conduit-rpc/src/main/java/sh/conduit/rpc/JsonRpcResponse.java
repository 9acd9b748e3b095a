// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static sh.conduit.rpc.internal.RpcUtils.MAPPER;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC 2.0 response envelope.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    /**
     * Wraps a bare result, as returned by in-process wallet channels that have no envelope.
     */
    public static JsonRpcResponse ofResult(final @Nullable Object result) {
        return new JsonRpcResponse("2.0", result, null, "0");
    }

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }

    @SuppressWarnings("unchecked")
    public @Nullable List<Object> resultAsList() {
        if (result == null) {
            return null;
        }
        if (result instanceof List<?>) {
            return (List<Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<List<Object>>() {});
    }
}
