// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import sh.conduit.core.crypto.PrivateKey;
import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.error.UserRejectedException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.wallet.ProviderKind;
import sh.conduit.wallet.ProviderReadiness;
import sh.conduit.wallet.WalletCapabilities;
import sh.conduit.wallet.WalletCapability;
import sh.conduit.wallet.WalletProviderAdapter;

/**
 * Wallet double backed by real keys. Each connect hands out the next queued account.
 */
final class TestWallet implements WalletProviderAdapter {

    static final String KEY_A = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    static final String KEY_B = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";

    private final ProviderKind kind;
    private final WalletCapabilities capabilities;
    private final Deque<PrivateKey> accounts = new ArrayDeque<>();
    private final List<String> signedMessages = new ArrayList<>();
    private final List<String> requests = new ArrayList<>();

    private volatile PrivateKey current;
    private volatile ProviderReadiness readiness = ProviderReadiness.READY_DISCONNECTED;
    private volatile Supplier<ProviderReadiness> readinessProbe;
    private volatile CompletableFuture<PrivateKey> pendingConnect;
    private volatile boolean rejectSignature;
    private volatile boolean failDisconnect;
    private volatile boolean rejectSwitch;
    private volatile long chainId = 8453L;
    private int disconnects;

    TestWallet(final ProviderKind kind, final WalletCapability... capabilities) {
        this.kind = kind;
        this.capabilities = capabilities.length == 0
                ? WalletCapabilities.of(WalletCapability.SIGN_MESSAGE, WalletCapability.SEND_TRANSACTION)
                : WalletCapabilities.of(capabilities[0], Arrays.copyOfRange(capabilities, 1, capabilities.length));
    }

    TestWallet withAccounts(final String... keys) {
        for (String key : keys) {
            accounts.add(PrivateKey.fromHex(key));
        }
        return this;
    }

    /** Marks the wallet as already connected to {@code key}, as after a page reload. */
    TestWallet restoredAs(final String key) {
        current = PrivateKey.fromHex(key);
        readiness = ProviderReadiness.READY_CONNECTED;
        return this;
    }

    void readiness(final ProviderReadiness readiness) {
        this.readiness = readiness;
    }

    void readinessProbe(final Supplier<ProviderReadiness> probe) {
        this.readinessProbe = probe;
    }

    /** Next connect returns this future instead of completing immediately. */
    void holdNextConnect(final CompletableFuture<PrivateKey> future) {
        this.pendingConnect = future;
    }

    void rejectSignature() {
        this.rejectSignature = true;
    }

    void failDisconnect() {
        this.failDisconnect = true;
    }

    void onChain(final long chainId) {
        this.chainId = chainId;
    }

    void rejectSwitch() {
        this.rejectSwitch = true;
    }

    synchronized List<String> signedMessages() {
        return List.copyOf(signedMessages);
    }

    synchronized List<String> requests() {
        return List.copyOf(requests);
    }

    synchronized int disconnects() {
        return disconnects;
    }

    static Address addressOf(final String key) {
        return PrivateKey.fromHex(key).toAddress();
    }

    @Override
    public ProviderKind kind() {
        return kind;
    }

    @Override
    public WalletCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public CompletableFuture<Address> connect() {
        final CompletableFuture<PrivateKey> held = pendingConnect;
        pendingConnect = null;
        final CompletableFuture<PrivateKey> source;
        if (held != null) {
            source = held;
        } else {
            final PrivateKey next;
            synchronized (this) {
                next = accounts.poll();
            }
            if (next == null) {
                return CompletableFuture.failedFuture(new UserRejectedException("User closed the connect prompt"));
            }
            source = CompletableFuture.completedFuture(next);
        }
        return source.thenApply(key -> {
            current = key;
            readiness = ProviderReadiness.READY_CONNECTED;
            return key.toAddress();
        });
    }

    @Override
    public ProviderReadiness readiness() {
        final Supplier<ProviderReadiness> probe = readinessProbe;
        return probe != null ? probe.get() : readiness;
    }

    @Override
    public Address getAddress() {
        final PrivateKey key = current;
        if (key == null) {
            throw new NotConnectedException("test wallet not connected");
        }
        return key.toAddress();
    }

    @Override
    public HexData signMessage(final String message) {
        if (rejectSignature) {
            throw new UserRejectedException("User rejected the signature request");
        }
        synchronized (this) {
            signedMessages.add(message);
        }
        return current.signMessage(message);
    }

    @Override
    public Object request(final String method, final List<?> params) {
        if (!capabilities.supports(WalletCapability.RAW_REQUEST)) {
            throw new CapabilityMissingException(WalletCapability.RAW_REQUEST.name(), name());
        }
        synchronized (this) {
            requests.add(method);
        }
        return switch (method) {
            case "eth_chainId" -> "0x" + Long.toHexString(chainId);
            case "wallet_switchEthereumChain" -> {
                if (rejectSwitch) {
                    throw new UserRejectedException("User rejected the network switch");
                }
                final Map<?, ?> target = (Map<?, ?>) params.get(0);
                chainId = Long.decode(target.get("chainId").toString());
                yield null;
            }
            default -> throw new CapabilityMissingException(method, name());
        };
    }

    @Override
    public void disconnect() {
        synchronized (this) {
            disconnects++;
        }
        current = null;
        readiness = ProviderReadiness.READY_DISCONNECTED;
        if (failDisconnect) {
            throw new IllegalStateException("wallet SDK crashed during disconnect");
        }
    }
}
