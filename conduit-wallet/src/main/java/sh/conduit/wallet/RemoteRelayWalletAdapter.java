// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

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

/**
 * Remote signer reached over a {@link RelayChannel}.
 * <p>
 * Each {@link #connect()} returns a future that the first account event for that attempt
 * completes. A newer connect cancels the older future, and events that arrive for a superseded
 * attempt are ignored. The relay never serves chain reads.
 */
public final class RemoteRelayWalletAdapter implements WalletProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteRelayWalletAdapter.class);

    private static final WalletCapabilities CAPABILITIES = WalletCapabilities.of(
            WalletCapability.SIGN_MESSAGE,
            WalletCapability.SEND_TRANSACTION,
            WalletCapability.RAW_REQUEST);

    private final RelayChannel channel;
    private final Object lock = new Object();
    private @Nullable CompletableFuture<Address> pending;
    private volatile @Nullable Address address;

    public RemoteRelayWalletAdapter(final RelayChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.REMOTE_RELAY;
    }

    @Override
    public WalletCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public CompletableFuture<Address> connect() {
        final CompletableFuture<Address> attempt = new CompletableFuture<>();
        synchronized (lock) {
            if (pending != null && !pending.isDone()) {
                LOG.debug("Superseding in-flight relay connect");
                pending.cancel(false);
            }
            pending = attempt;
        }
        channel.open(new AttemptListener(attempt));
        return attempt;
    }

    @Override
    public ProviderReadiness readiness() {
        if (address != null) {
            return ProviderReadiness.READY_CONNECTED;
        }
        if (!channel.restoreComplete()) {
            return ProviderReadiness.NOT_READY;
        }
        final Optional<Address> restored = channel.restoredAccount();
        if (restored.isEmpty()) {
            return ProviderReadiness.READY_DISCONNECTED;
        }
        address = restored.get();
        return ProviderReadiness.READY_CONNECTED;
    }

    @Override
    public Address getAddress() {
        final Address current = address;
        if (current == null) {
            throw new NotConnectedException("relay wallet is not connected");
        }
        return current;
    }

    @Override
    public HexData signMessage(final String message) {
        final Object signature = call("personal_sign", List.of(Hex.encodeUtf8(message), getAddress().value()));
        return new HexData(String.valueOf(signature));
    }

    @Override
    public Hash sendTransaction(final TransactionRequest request) {
        final Object hash = call("eth_sendTransaction", List.of(request.toRpcObject()));
        return new Hash(String.valueOf(hash));
    }

    @Override
    public @Nullable Object request(final String method, final List<?> params) {
        return call(method, params);
    }

    @Override
    public void disconnect() {
        synchronized (lock) {
            if (pending != null && !pending.isDone()) {
                pending.cancel(false);
            }
            pending = null;
            address = null;
        }
        channel.close();
    }

    private @Nullable Object call(final String method, final List<?> params) {
        try {
            return channel.request(method, params);
        } catch (RpcException e) {
            throw WalletErrors.classify(e, method, name());
        }
    }

    private final class AttemptListener implements RelayChannel.Listener {

        private final CompletableFuture<Address> attempt;

        AttemptListener(final CompletableFuture<Address> attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onAccountsChanged(final List<Address> accounts) {
            synchronized (lock) {
                if (pending != attempt) {
                    LOG.debug("Ignoring account event for superseded relay connect");
                    return;
                }
                if (accounts.isEmpty()) {
                    address = null;
                    return;
                }
                address = accounts.get(0);
                attempt.complete(accounts.get(0));
            }
        }

        @Override
        public void onDisconnect(final String reason) {
            synchronized (lock) {
                if (pending != attempt) {
                    return;
                }
                address = null;
                attempt.completeExceptionally(new NotConnectedException("relay disconnected: " + reason));
            }
        }
    }
}
