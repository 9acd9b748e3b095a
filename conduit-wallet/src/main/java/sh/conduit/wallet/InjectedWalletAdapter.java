// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;
import sh.conduit.primitives.Hex;
import sh.conduit.rpc.RpcProvider;

/**
 * Browser-extension wallet reached through its EIP-1193 request channel.
 * <p>
 * The wallet signs and broadcasts itself; it does not hand out signed bytes.
 */
public final class InjectedWalletAdapter implements WalletProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(InjectedWalletAdapter.class);

    private static final WalletCapabilities CAPABILITIES = WalletCapabilities.of(
            WalletCapability.SIGN_MESSAGE,
            WalletCapability.SEND_TRANSACTION,
            WalletCapability.RAW_REQUEST);

    private final RpcProvider wallet;
    private final Executor executor;
    private volatile @Nullable Address address;

    public InjectedWalletAdapter(final RpcProvider wallet, final Executor executor) {
        this.wallet = Objects.requireNonNull(wallet, "wallet");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public InjectedWalletAdapter(final RpcProvider wallet) {
        this(wallet, ForkJoinPool.commonPool());
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.INJECTED;
    }

    @Override
    public WalletCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public CompletableFuture<Address> connect() {
        return CompletableFuture.supplyAsync(() -> {
            final Address account = firstAccount(call("eth_requestAccounts", List.of()));
            if (account == null) {
                throw new NotConnectedException("injected wallet returned no accounts");
            }
            address = account;
            LOG.debug("Injected wallet connected as {}", account);
            return account;
        }, executor);
    }

    /**
     * Probes {@code eth_accounts}, which never prompts. A transport failure means the extension
     * has not injected itself yet.
     */
    @Override
    public ProviderReadiness readiness() {
        if (address != null) {
            return ProviderReadiness.READY_CONNECTED;
        }
        final Object accounts;
        try {
            accounts = wallet.send("eth_accounts", List.of()).result();
        } catch (RpcException e) {
            if (e.code() == RpcException.NETWORK_ERROR_CODE) {
                LOG.debug("Injected wallet not ready: {}", e.getMessage());
                return ProviderReadiness.NOT_READY;
            }
            throw WalletErrors.classify(e, "eth_accounts", name());
        }
        final Address restored = firstAccount(accounts);
        if (restored == null) {
            return ProviderReadiness.READY_DISCONNECTED;
        }
        address = restored;
        return ProviderReadiness.READY_CONNECTED;
    }

    @Override
    public Address getAddress() {
        final Address current = address;
        if (current == null) {
            throw new NotConnectedException("injected wallet is not connected");
        }
        return current;
    }

    @Override
    public HexData signMessage(final String message) {
        CAPABILITIES.require(WalletCapability.SIGN_MESSAGE, name());
        final Object signature = call("personal_sign", List.of(Hex.encodeUtf8(message), getAddress().value()));
        return new HexData(String.valueOf(signature));
    }

    @Override
    public Hash sendTransaction(final TransactionRequest request) {
        CAPABILITIES.require(WalletCapability.SEND_TRANSACTION, name());
        final Object hash = call("eth_sendTransaction", List.of(request.toRpcObject()));
        return new Hash(String.valueOf(hash));
    }

    @Override
    public @Nullable Object request(final String method, final List<?> params) {
        return call(method, params);
    }

    /**
     * Drops the local account and asks the wallet to revoke the permission grant. Wallets
     * without {@code wallet_revokePermissions} keep the grant; that is not an error.
     */
    @Override
    public void disconnect() {
        address = null;
        try {
            wallet.send("wallet_revokePermissions", List.of(Map.of("eth_accounts", Map.of())));
        } catch (RpcException e) {
            if (!e.isMethodMissing()) {
                throw WalletErrors.classify(e, "wallet_revokePermissions", name());
            }
            LOG.debug("Injected wallet cannot revoke permissions: {}", e.getMessage());
        }
    }

    private @Nullable Object call(final String method, final List<?> params) {
        try {
            return wallet.send(method, params).result();
        } catch (RpcException e) {
            throw WalletErrors.classify(e, method, name());
        }
    }

    private static @Nullable Address firstAccount(final @Nullable Object accounts) {
        if (accounts instanceof List<?> list && !list.isEmpty() && list.get(0) != null) {
            return new Address(list.get(0).toString());
        }
        return null;
    }
}
