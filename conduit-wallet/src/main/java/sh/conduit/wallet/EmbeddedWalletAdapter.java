// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.crypto.PrivateKey;
import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.tx.SignedTransaction;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;

/**
 * Social-login account that signs locally, without user prompts.
 * <p>
 * Transactions are signed as EIP-155 legacy transactions for the configured chain and must be
 * broadcast by the caller through the trusted endpoint.
 */
public final class EmbeddedWalletAdapter implements WalletProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(EmbeddedWalletAdapter.class);

    private static final WalletCapabilities CAPABILITIES = WalletCapabilities.of(
            WalletCapability.SIGN_MESSAGE,
            WalletCapability.SIGN_TRANSACTION);

    private final EmbeddedAccountSource source;
    private final long chainId;
    private volatile @Nullable PrivateKey key;

    public EmbeddedWalletAdapter(final EmbeddedAccountSource source, final long chainId) {
        this.source = Objects.requireNonNull(source, "source");
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive");
        }
        this.chainId = chainId;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.EMBEDDED;
    }

    @Override
    public WalletCapabilities capabilities() {
        return CAPABILITIES;
    }

    public long chainId() {
        return chainId;
    }

    @Override
    public CompletableFuture<Address> connect() {
        return source.login().thenApply(loggedIn -> {
            key = loggedIn;
            final Address address = loggedIn.toAddress();
            LOG.debug("Embedded wallet logged in as {}", address);
            return address;
        });
    }

    @Override
    public ProviderReadiness readiness() {
        if (key != null) {
            return ProviderReadiness.READY_CONNECTED;
        }
        if (!source.restoreComplete()) {
            return ProviderReadiness.NOT_READY;
        }
        final Optional<PrivateKey> restored = source.restored();
        if (restored.isEmpty()) {
            return ProviderReadiness.READY_DISCONNECTED;
        }
        key = restored.get();
        return ProviderReadiness.READY_CONNECTED;
    }

    @Override
    public Address getAddress() {
        return requireKey().toAddress();
    }

    @Override
    public HexData signMessage(final String message) {
        return requireKey().signMessage(message);
    }

    @Override
    public SignedTransaction signTransaction(final TransactionRequest request) {
        final PrivateKey signer = requireKey();
        if (!request.from().equals(signer.toAddress())) {
            throw new IllegalArgumentException("Transaction sender " + request.from()
                    + " does not match embedded account " + signer.toAddress());
        }
        return request.toLegacyTransaction().sign(signer, chainId);
    }

    @Override
    public boolean supportsHeadlessSigning() {
        return true;
    }

    @Override
    public void disconnect() {
        final PrivateKey current = key;
        key = null;
        if (current != null) {
            current.destroy();
        }
        source.logout();
    }

    private PrivateKey requireKey() {
        final PrivateKey current = key;
        if (current == null || current.isDestroyed()) {
            throw new NotConnectedException("embedded wallet is not logged in");
        }
        return current;
    }
}
