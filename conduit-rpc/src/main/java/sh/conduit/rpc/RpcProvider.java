// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import java.util.List;

import sh.conduit.core.error.RpcException;

/**
 * A JSON-RPC endpoint: a trusted node over HTTP, or a wallet's EIP-1193 request channel.
 * <p>
 * Implementations throw {@link RpcException} both for transport failures and for JSON-RPC
 * error responses, so a returned response never carries an error.
 */
public interface RpcProvider extends AutoCloseable {

    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    @Override
    default void close() {
    }
}
