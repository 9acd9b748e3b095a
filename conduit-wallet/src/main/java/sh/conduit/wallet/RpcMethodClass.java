// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.Set;

/**
 * Routing class of a JSON-RPC method.
 */
public enum RpcMethodClass {
    /** Idempotent chain read, served by the trusted endpoint with transient retry. */
    READ,
    /** Needs the wallet's signing authority; never retried. */
    WRITE,
    /** Already-signed payload, sent to the trusted endpoint once. */
    BROADCAST,
    /** Wallet first, trusted endpoint if the wallet lacks the method. */
    UNKNOWN;

    private static final Set<String> READ_METHODS = Set.of(
            "eth_chainId",
            "net_version",
            "eth_gasPrice",
            "eth_blockNumber",
            "eth_getBalance",
            "eth_getCode",
            "eth_getStorageAt",
            "eth_getBlockByNumber",
            "eth_getBlockByHash",
            "eth_getTransactionByHash",
            "eth_getTransactionReceipt",
            "eth_getTransactionCount",
            "eth_call",
            "eth_estimateGas",
            "eth_feeHistory",
            "eth_maxPriorityFeePerGas",
            "eth_getLogs",
            "eth_newFilter",
            "eth_newBlockFilter",
            "eth_getFilterChanges",
            "eth_getFilterLogs",
            "eth_uninstallFilter");

    private static final Set<String> WRITE_METHODS = Set.of(
            "personal_sign",
            "eth_sign",
            "eth_signTypedData",
            "eth_signTypedData_v3",
            "eth_signTypedData_v4",
            "eth_sendTransaction",
            "eth_signTransaction",
            "eth_accounts",
            "eth_requestAccounts",
            "wallet_switchEthereumChain",
            "wallet_addEthereumChain");

    public static RpcMethodClass classify(final String method) {
        if (READ_METHODS.contains(method)) {
            return READ;
        }
        if (WRITE_METHODS.contains(method)) {
            return WRITE;
        }
        if ("eth_sendRawTransaction".equals(method)) {
            return BROADCAST;
        }
        return UNKNOWN;
    }
}
