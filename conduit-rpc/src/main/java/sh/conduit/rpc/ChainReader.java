// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import static sh.conduit.rpc.internal.RpcUtils.MAPPER;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.RpcException;
import sh.conduit.core.model.BlockSummary;
import sh.conduit.core.model.Transaction;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.Wei;
import sh.conduit.rpc.internal.RpcUtils;

/**
 * Typed chain reads against a trusted endpoint.
 * <p>
 * Every call is idempotent and goes through {@link RpcRetry}. When retries run out the
 * failure surfaces as an {@link RpcException} whose cause is the {@link RetryExhaustedException}.
 */
public final class ChainReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RpcProvider provider;
    private final RpcRetryConfig retryConfig;

    public ChainReader(final RpcProvider provider, final RpcRetryConfig retryConfig) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
    }

    public ChainReader(final RpcProvider provider) {
        this(provider, RpcRetryConfig.defaults());
    }

    public long chainId() {
        return call("eth_chainId", List.of(), RpcUtils::decodeHexLong);
    }

    public long blockNumber() {
        return call("eth_blockNumber", List.of(), RpcUtils::decodeHexLong);
    }

    public Wei gasPrice() {
        return call("eth_gasPrice", List.of(), hex -> new Wei(RpcUtils.decodeHexBigInteger(hex.toString())));
    }

    public Wei getBalance(final Address address) {
        return call("eth_getBalance", List.of(address.value(), "latest"),
                hex -> new Wei(RpcUtils.decodeHexBigInteger(hex.toString())));
    }

    /**
     * @param blockTag {@code "latest"} for mined transactions, {@code "pending"} to include the mempool
     */
    public long getTransactionCount(final Address address, final String blockTag) {
        return call("eth_getTransactionCount", List.of(address.value(), blockTag), RpcUtils::decodeHexLong);
    }

    public long estimateGas(final TransactionRequest request) {
        return call("eth_estimateGas", List.of(request.toRpcObject()), RpcUtils::decodeHexLong);
    }

    public @Nullable BlockSummary getBlockByNumber(final long number) {
        return callNullable("eth_getBlockByNumber", List.of(RpcUtils.toQuantityHex(number), Boolean.FALSE),
                this::parseBlock);
    }

    public @Nullable Transaction getTransactionByHash(final Hash hash) {
        return callNullable("eth_getTransactionByHash", List.of(hash.value()), this::parseTransaction);
    }

    public @Nullable TransactionReceipt getTransactionReceipt(final Hash hash) {
        return callNullable("eth_getTransactionReceipt", List.of(hash.value()), this::parseReceipt);
    }

    private <T> T call(final String method, final List<?> params, final Function<Object, T> decoder) {
        final T value = callNullable(method, params, decoder);
        if (value == null) {
            throw new RpcException(-32000, method + " returned null", null, null);
        }
        return value;
    }

    /**
     * Raw read with transient retry. Used by the router for read methods it has no typed call for.
     */
    public @Nullable Object read(final String method, final List<?> params) {
        try {
            return RpcRetry.run(() -> provider.send(method, params), retryConfig).result();
        } catch (RetryExhaustedException e) {
            final RpcException last = e.rpcCause();
            throw new RpcException(
                    last != null ? last.code() : RpcException.NETWORK_ERROR_CODE,
                    method + " failed after " + e.getAttemptCount() + " attempts",
                    last != null ? last.data() : null,
                    null,
                    e);
        }
    }

    private <T> @Nullable T callNullable(final String method, final List<?> params, final Function<Object, T> decoder) {
        final Object result = read(method, params);
        return result == null ? null : decoder.apply(result);
    }

    private BlockSummary parseBlock(final Object result) {
        final Map<String, Object> map = MAPPER.convertValue(result, MAP_TYPE);
        final List<Hash> hashes = new ArrayList<>();
        final Object txs = map.get("transactions");
        if (txs instanceof List<?> list) {
            for (Object tx : list) {
                if (tx instanceof Map<?, ?> full) {
                    hashes.add(new Hash(String.valueOf(full.get("hash"))));
                } else if (tx != null) {
                    hashes.add(new Hash(tx.toString()));
                }
            }
        }
        return new BlockSummary(
                RpcUtils.decodeHexLong(map.get("number")),
                new Hash(requireField(map, "hash", "eth_getBlockByNumber")),
                hashes);
    }

    private Transaction parseTransaction(final Object result) {
        final Map<String, Object> map = MAPPER.convertValue(result, MAP_TYPE);
        final String to = RpcUtils.stringValue(map.get("to"));
        return new Transaction(
                new Hash(requireField(map, "hash", "eth_getTransactionByHash")),
                new Address(requireField(map, "from", "eth_getTransactionByHash")),
                to != null ? new Address(to) : null,
                RpcUtils.decodeHexLong(requireField(map, "nonce", "eth_getTransactionByHash")),
                RpcUtils.decodeHexLong(map.get("blockNumber")));
    }

    private TransactionReceipt parseReceipt(final Object result) {
        final Map<String, Object> map = MAPPER.convertValue(result, MAP_TYPE);
        final String to = RpcUtils.stringValue(map.get("to"));
        final String contractAddress = RpcUtils.stringValue(map.get("contractAddress"));
        return new TransactionReceipt(
                new Hash(requireField(map, "transactionHash", "eth_getTransactionReceipt")),
                RpcUtils.decodeHexLong(requireField(map, "blockNumber", "eth_getTransactionReceipt")),
                new Address(requireField(map, "from", "eth_getTransactionReceipt")),
                to != null ? new Address(to) : null,
                contractAddress != null ? new Address(contractAddress) : null,
                "0x1".equals(RpcUtils.stringValue(map.get("status"))));
    }

    private static String requireField(final Map<String, Object> map, final String field, final String method) {
        final Object value = map.get(field);
        if (value == null) {
            throw new RpcException(-32000, method + " response missing '" + field + "' field", null, null);
        }
        return value.toString();
    }
}
