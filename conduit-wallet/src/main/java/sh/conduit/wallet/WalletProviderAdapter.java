// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.tx.SignedTransaction;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;

/**
 * Uniform view over a wallet SDK.
 * <p>
 * Optional operations are gated by {@link #capabilities()}: an operation that is not declared
 * fails with {@link CapabilityMissingException} before the SDK is contacted. Implementations
 * re-classify SDK errors into the {@code sh.conduit.core.error} taxonomy.
 */
public interface WalletProviderAdapter {

    ProviderKind kind();

    WalletCapabilities capabilities();

    /**
     * Runs the interactive connect flow. The future completes exactly once with the account
     * address, or exceptionally with a {@code WalletException}.
     */
    CompletableFuture<Address> connect();

    /**
     * Non-interactive restore probe. Must not prompt the user.
     */
    ProviderReadiness readiness();

    default boolean isConnected() {
        return readiness() == ProviderReadiness.READY_CONNECTED;
    }

    /**
     * @throws NotConnectedException if no account is connected
     */
    Address getAddress();

    default HexData signMessage(final String message) {
        throw missing(WalletCapability.SIGN_MESSAGE);
    }

    default SignedTransaction signTransaction(final TransactionRequest request) {
        throw missing(WalletCapability.SIGN_TRANSACTION);
    }

    /**
     * Signs and broadcasts through the wallet. The returned hash is untrusted.
     */
    default Hash sendTransaction(final TransactionRequest request) {
        throw missing(WalletCapability.SEND_TRANSACTION);
    }

    /**
     * Raw EIP-1193 passthrough, for methods with no typed operation.
     */
    default @Nullable Object request(final String method, final List<?> params) {
        throw missing(WalletCapability.RAW_REQUEST);
    }

    /**
     * Revokes the wallet connection. Local adapter state is cleared even when the SDK call fails.
     */
    void disconnect();

    default boolean supportsHeadlessSigning() {
        return false;
    }

    default String name() {
        return kind().name().toLowerCase(Locale.ROOT);
    }

    private CapabilityMissingException missing(final WalletCapability capability) {
        return new CapabilityMissingException(capability.name(), name());
    }
}
