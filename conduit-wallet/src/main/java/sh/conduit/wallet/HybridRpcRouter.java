// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import static sh.conduit.rpc.internal.RpcUtils.MAPPER;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.DebugLogger;
import sh.conduit.core.LogFormatter;
import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.core.types.Wei;
import sh.conduit.primitives.Hex;
import sh.conduit.rpc.ChainReader;
import sh.conduit.rpc.RpcProvider;
import sh.conduit.rpc.RpcRetryConfig;
import sh.conduit.rpc.internal.RpcUtils;

/**
 * Provider facade that answers reads from a trusted endpoint and forwards signing to the wallet.
 * <p>
 * Wallets reject some read methods inconsistently, so no read ever reaches the wallet. Callers
 * see a single {@link #request(String, List)} entry point and cannot tell the two paths apart
 * except by the absence of read failures.
 */
public final class HybridRpcRouter {

    private static final Logger LOG = LoggerFactory.getLogger(HybridRpcRouter.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WalletProviderAdapter wallet;
    private final RpcProvider trusted;
    private final ChainReader reader;

    public HybridRpcRouter(
            final WalletProviderAdapter wallet, final RpcProvider trusted, final RpcRetryConfig retryConfig) {
        this.wallet = Objects.requireNonNull(wallet, "wallet");
        this.trusted = Objects.requireNonNull(trusted, "trusted");
        this.reader = new ChainReader(trusted, retryConfig);
    }

    public HybridRpcRouter(final WalletProviderAdapter wallet, final RpcProvider trusted) {
        this(wallet, trusted, RpcRetryConfig.defaults());
    }

    public @Nullable Object request(final String method, final List<?> params) {
        final List<?> safeParams = params == null ? List.of() : params;
        final RpcMethodClass route = RpcMethodClass.classify(method);
        final long start = System.nanoTime();
        final Object result = switch (route) {
            case READ -> reader.read(method, safeParams);
            case WRITE -> write(method, safeParams);
            case BROADCAST -> trusted.send(method, safeParams).result();
            case UNKNOWN -> unknown(method, safeParams);
        };
        DebugLogger.logRpc(LogFormatter.formatRpc(method, route.name(), (System.nanoTime() - start) / 1_000L));
        return result;
    }

    /**
     * Typed reads against the trusted endpoint.
     */
    public ChainReader reader() {
        return reader;
    }

    public WalletProviderAdapter wallet() {
        return wallet;
    }

    /**
     * Chain the wallet itself is on, or {@code null} when the wallet exposes no request channel
     * and signs for a fixed chain.
     */
    public @Nullable Long walletChainId() {
        if (!wallet.capabilities().supports(WalletCapability.RAW_REQUEST)) {
            return null;
        }
        return RpcUtils.decodeHexLong(wallet.request("eth_chainId", List.of()));
    }

    public void switchWalletChain(final long chainId) {
        wallet.request("wallet_switchEthereumChain",
                List.of(Map.of("chainId", RpcUtils.toQuantityHex(chainId))));
    }

    private @Nullable Object write(final String method, final List<?> params) {
        if (wallet.capabilities().supports(WalletCapability.RAW_REQUEST)) {
            return wallet.request(method, params);
        }
        return switch (method) {
            case "eth_accounts", "eth_requestAccounts" -> List.of(wallet.getAddress().value());
            case "personal_sign" -> wallet.signMessage(decodePersonalMessage(params)).value();
            case "eth_sendTransaction" -> wallet.sendTransaction(parseTransaction(params)).value();
            case "eth_signTransaction" -> wallet.signTransaction(parseTransaction(params)).raw().value();
            default -> throw new CapabilityMissingException(method, wallet.name());
        };
    }

    private @Nullable Object unknown(final String method, final List<?> params) {
        if (!wallet.capabilities().supports(WalletCapability.RAW_REQUEST)) {
            return trusted.send(method, params).result();
        }
        try {
            return wallet.request(method, params);
        } catch (CapabilityMissingException e) {
            LOG.debug("{} wallet lacks {}; falling back to trusted endpoint", wallet.name(), method);
            return trusted.send(method, params).result();
        }
    }

    private static String decodePersonalMessage(final List<?> params) {
        if (params.isEmpty() || params.get(0) == null) {
            throw new RpcException(-32602, "personal_sign requires a message parameter");
        }
        final String message = params.get(0).toString();
        if (!Hex.hasPrefix(message)) {
            return message;
        }
        return new String(Hex.decode(message), StandardCharsets.UTF_8);
    }

    private static TransactionRequest parseTransaction(final List<?> params) {
        if (params.isEmpty() || params.get(0) == null) {
            throw new RpcException(-32602, "transaction object parameter is required");
        }
        final Map<String, Object> tx = MAPPER.convertValue(params.get(0), MAP_TYPE);
        final String from = RpcUtils.stringValue(tx.get("from"));
        if (from == null) {
            throw new RpcException(-32602, "transaction object is missing 'from'");
        }
        final String to = RpcUtils.stringValue(tx.get("to"));
        final String data = RpcUtils.stringValue(tx.containsKey("data") ? tx.get("data") : tx.get("input"));
        final String gasPrice = RpcUtils.stringValue(tx.get("gasPrice"));
        return new TransactionRequest(
                new Address(from),
                to != null ? new Address(to) : null,
                new Wei(RpcUtils.decodeHexBigInteger(RpcUtils.stringValue(tx.get("value")))),
                data != null ? new HexData(data) : HexData.EMPTY,
                RpcUtils.decodeHexLong(tx.containsKey("gas") ? tx.get("gas") : tx.get("gasLimit")),
                gasPrice != null ? new Wei(RpcUtils.decodeHexBigInteger(gasPrice)) : null,
                RpcUtils.decodeHexLong(tx.get("nonce")));
    }
}
