// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.error.BackendAuthException;
import sh.conduit.core.error.ChainMismatchException;
import sh.conduit.core.error.ConduitException;
import sh.conduit.core.error.ErrorKind;
import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.rpc.ChainReader;
import sh.conduit.rpc.RpcProvider;
import sh.conduit.session.auth.BackendAuthClient;
import sh.conduit.session.auth.LoginRequest;
import sh.conduit.session.auth.SignInMessage;
import sh.conduit.session.token.AuthToken;
import sh.conduit.session.token.AuthTokens;
import sh.conduit.session.token.TokenStore;
import sh.conduit.wallet.HybridRpcRouter;
import sh.conduit.wallet.ProviderKind;
import sh.conduit.wallet.ProviderReadiness;
import sh.conduit.wallet.WalletProviderAdapter;
import sh.conduit.wallet.tx.HashReconciler;
import sh.conduit.wallet.tx.NonceSequencer;
import sh.conduit.wallet.tx.Sleeper;
import sh.conduit.wallet.tx.TransactionSubmitter;

/**
 * Owns the wallet session: which adapter is active, its address, and the backend token.
 * <p>
 * The {@link Session} is only replaced wholesale, under this manager's lock, and listeners
 * hear about each replacement once. Wallet and backend calls run outside the lock. Every
 * connect, disconnect and restore takes a new generation; a result that arrives after its
 * generation was superseded is discarded instead of being applied.
 * <p>
 * A restore probe that finds a wallet {@link ProviderReadiness#NOT_READY} leaves the session
 * disconnected but retries on the next {@link #provider()}, {@link #transactions()} or
 * {@link #requireAuthenticated()} call.
 */
public final class SessionManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    private final SessionConfig config;
    private final RpcProvider trusted;
    private final BackendAuthClient authClient;
    private final TokenStore tokenStore;
    private final Map<ProviderKind, WalletProviderAdapter> adapters;
    private final Clock clock;
    private final Sleeper sleeper;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> cacheClearers = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final Object authLock = new Object();

    private SessionState state = SessionState.UNINITIALIZED;
    private Session session = Session.EMPTY;
    private long generation;
    private @Nullable WalletProviderAdapter active;
    private boolean restorePending;
    private @Nullable HybridRpcRouter router;
    private @Nullable TransactionSubmitter submitter;

    private SessionManager(final Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.trusted = Objects.requireNonNull(builder.trusted, "trustedRpc");
        this.authClient = Objects.requireNonNull(builder.authClient, "authClient");
        this.tokenStore = builder.tokenStore != null ? builder.tokenStore : TokenStore.inMemory();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
        if (builder.adapters.isEmpty()) {
            throw new IllegalArgumentException("at least one wallet adapter is required");
        }
        this.adapters = new LinkedHashMap<>(builder.adapters);
    }

    public static Builder builder(final SessionConfig config) {
        return new Builder(config);
    }

    public Session getSession() {
        synchronized (lock) {
            return session;
        }
    }

    public SessionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public void addListener(final SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a hook run at the end of every {@link #disconnect()}, for singletons that cache
     * anything derived from the session.
     */
    public void registerCacheClearer(final Runnable clearer) {
        cacheClearers.add(Objects.requireNonNull(clearer, "clearer"));
    }

    /**
     * Probes the adapters in registration order and restores the first connected one. Returns
     * immediately, without side effects, when a session is already authenticated or a restore
     * or connect is in flight.
     */
    public Session initialize() {
        final long gen;
        synchronized (lock) {
            if (state == SessionState.AUTHENTICATED
                    || state == SessionState.CONNECTED_UNAUTHENTICATED
                    || state.isTransitioning()) {
                return session;
            }
            state = SessionState.INITIALIZING;
            gen = ++generation;
        }
        restore(gen);
        return getSession();
    }

    /**
     * Connects the adapter for {@code kind}, checks its chain, and signs in with the backend.
     * Replaces any previous session: its token is logged out and erased, a different previous
     * wallet is disconnected, and the session reads empty while connecting. On failure nothing
     * of the attempt stays observable: the session is empty, the token store is cleared, and the
     * state is DISCONNECTED for a backend auth failure or ERROR for anything else.
     */
    public Session connect(final ProviderKind kind) {
        final WalletProviderAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalArgumentException("No wallet adapter registered for " + kind);
        }
        final long gen;
        final WalletProviderAdapter previous;
        final AuthToken previousToken;
        final TransactionSubmitter staleSubmitter;
        final Session replaced;
        synchronized (lock) {
            gen = ++generation;
            previous = active;
            previousToken = session.authToken() != null ? session.authToken() : tokenStore.current();
            active = adapter;
            state = SessionState.CONNECTING;
            restorePending = false;
            staleSubmitter = dropCaches();
            replaced = replace(Session.EMPTY);
            // the new wallet signs in afresh; no earlier token may outlive the switch
            try {
                tokenStore.clear();
            } catch (RuntimeException e) {
                LOG.warn("Token storage not fully cleared before connect", e);
            }
        }
        notifyListeners(replaced);
        if (staleSubmitter != null) {
            staleSubmitter.reset();
        }
        if (previousToken != null) {
            try {
                authClient.logout(previousToken.value());
            } catch (RuntimeException e) {
                LOG.warn("Backend logout of the replaced session failed", e);
            }
        }
        if (previous != null && previous != adapter) {
            disconnectAdapter(previous);
        }
        LOG.info("Connecting {} wallet", adapter.name());

        try {
            final Address address = awaitAddress(adapter);
            final HybridRpcRouter connected = new HybridRpcRouter(adapter, trusted, config.readRetry());
            ensureChain(connected);
            synchronized (lock) {
                requireCurrent(gen, adapter);
                router = connected;
            }
            return authenticate(adapter, address, gen, true);
        } catch (RuntimeException e) {
            rollback(gen, adapter, e);
            throw e;
        }
    }

    /**
     * Tears the session down: revokes the wallet and backend session, erases the token from
     * every location, empties the session, then runs the registered cache clearers. Each step
     * runs even when an earlier one fails.
     */
    public void disconnect() {
        final WalletProviderAdapter adapter;
        final AuthToken token;
        synchronized (lock) {
            generation++;
            adapter = active;
            token = session.authToken() != null ? session.authToken() : tokenStore.current();
        }

        // 1. wallet and backend revoke
        if (token != null) {
            try {
                authClient.logout(token.value());
            } catch (RuntimeException e) {
                LOG.warn("Backend logout failed; clearing local session anyway", e);
            }
        }
        if (adapter != null) {
            disconnectAdapter(adapter);
        }

        // 2. token storage
        try {
            tokenStore.clear();
        } catch (RuntimeException e) {
            LOG.warn("Token storage not fully cleared", e);
        }

        // 3. session
        final Session replaced;
        final TransactionSubmitter staleSubmitter;
        synchronized (lock) {
            state = SessionState.DISCONNECTED;
            active = null;
            restorePending = false;
            staleSubmitter = dropCaches();
            replaced = replace(Session.EMPTY);
        }
        notifyListeners(replaced);

        // 4. dependent caches
        if (staleSubmitter != null) {
            staleSubmitter.reset();
        }
        for (Runnable clearer : cacheClearers) {
            try {
                clearer.run();
            } catch (RuntimeException e) {
                LOG.warn("Cache clearer failed", e);
            }
        }
        LOG.info("Wallet session disconnected");
    }

    /**
     * Token of the authenticated session. A restore deferred at {@link #initialize()} is
     * retried first, and a connected but unauthenticated session signs in now.
     *
     * @throws NotConnectedException if no wallet is connected
     */
    public AuthToken requireAuthenticated() {
        retryPendingRestore();
        synchronized (authLock) {
            final WalletProviderAdapter adapter;
            final Address address;
            final long gen;
            synchronized (lock) {
                if (state == SessionState.AUTHENTICATED && session.authToken() != null) {
                    return session.authToken();
                }
                if (state != SessionState.CONNECTED_UNAUTHENTICATED || active == null || session.address() == null) {
                    throw new NotConnectedException("No authenticated wallet session (state " + state + ")");
                }
                adapter = active;
                address = session.address();
                gen = generation;
            }
            try {
                return Objects.requireNonNull(authenticate(adapter, address, gen, false).authToken());
            } catch (RuntimeException e) {
                rollback(gen, adapter, e);
                throw e;
            }
        }
    }

    /**
     * Signs a connected session in with a token issued by a social-login provider instead of a
     * signed message.
     */
    public Session loginWithProviderToken(final String providerToken) {
        Objects.requireNonNull(providerToken, "providerToken");
        synchronized (authLock) {
            final WalletProviderAdapter adapter;
            final Address address;
            final long gen;
            synchronized (lock) {
                if (!state.hasWallet() || active == null || session.address() == null) {
                    throw new NotConnectedException("No wallet connected (state " + state + ")");
                }
                adapter = active;
                address = session.address();
                gen = generation;
            }
            try {
                return exchange(adapter, address, gen, new LoginRequest.Token(providerToken, address));
            } catch (RuntimeException e) {
                rollback(gen, adapter, e);
                throw e;
            }
        }
    }

    /**
     * Router for the connected wallet, cached until the connection changes.
     *
     * @throws NotConnectedException if no wallet is connected
     */
    public HybridRpcRouter provider() {
        retryPendingRestore();
        synchronized (lock) {
            return currentRouter();
        }
    }

    /**
     * Transaction submitter bound to {@link #provider()}, cached until the connection changes.
     */
    public TransactionSubmitter transactions() {
        retryPendingRestore();
        synchronized (lock) {
            final HybridRpcRouter current = currentRouter();
            if (submitter == null) {
                final ChainReader reader = current.reader();
                submitter = new TransactionSubmitter(
                        current,
                        new NonceSequencer(reader),
                        config.gasPolicy(),
                        new HashReconciler(reader, config.retryPolicy(), sleeper),
                        config.retryPolicy(),
                        sleeper);
            }
            return submitter;
        }
    }

    @Override
    public void close() {
        disconnect();
        listeners.clear();
        cacheClearers.clear();
    }

    private void restore(final long gen) {
        boolean notReady = false;
        for (WalletProviderAdapter adapter : adapters.values()) {
            final ProviderReadiness readiness;
            try {
                readiness = adapter.readiness();
            } catch (RuntimeException e) {
                LOG.warn("Readiness probe for {} failed", adapter.name(), e);
                continue;
            }
            switch (readiness) {
                case READY_CONNECTED -> {
                    restoreFrom(adapter, gen);
                    return;
                }
                case NOT_READY -> notReady = true;
                case READY_DISCONNECTED -> {
                }
            }
        }
        if (notReady) {
            LOG.debug("A wallet SDK is still restoring; will retry on first use");
        }
        settleDisconnected(gen, notReady);
    }

    private void restoreFrom(final WalletProviderAdapter adapter, final long gen) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = SessionState.RESTORING_SESSION;
        }
        final Address address;
        final Optional<AuthToken> token;
        try {
            address = adapter.getAddress();
            token = tokenStore.load().filter(stored -> belongsTo(stored, adapter.kind(), address));
        } catch (RuntimeException e) {
            LOG.warn("Restoring {} wallet failed", adapter.name(), e);
            settleDisconnected(gen, false);
            return;
        }
        final Session restored = token
                .map(stored -> Session.authenticated(adapter.kind(), address, stored))
                .orElseGet(() -> Session.connected(adapter.kind(), address));
        final Session replaced;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = token.isPresent() ? SessionState.AUTHENTICATED : SessionState.CONNECTED_UNAUTHENTICATED;
            active = adapter;
            restorePending = false;
            replaced = replace(restored);
        }
        LOG.info("Restored {} wallet session for {}", adapter.name(), address);
        notifyListeners(replaced);
    }

    private boolean belongsTo(final AuthToken token, final ProviderKind kind, final Address address) {
        if (token.location() != TokenStore.locationFor(kind)) {
            LOG.info("Stored {} token was not issued to a {} wallet; discarding it", token.location(), kind);
            tokenStore.clear();
            return false;
        }
        final Map<String, Object> claims = AuthTokens.decodeClaims(token.value());
        final Object owner = claims.containsKey("walletAddress") ? claims.get("walletAddress") : claims.get("address");
        if (owner instanceof String ownerAddress && !ownerAddress.equalsIgnoreCase(address.value())) {
            LOG.info("Stored token belongs to another wallet; discarding it");
            tokenStore.clear();
            return false;
        }
        return true;
    }

    private void settleDisconnected(final long gen, final boolean retryLater) {
        final Session replaced;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = SessionState.DISCONNECTED;
            restorePending = retryLater;
            replaced = replace(Session.EMPTY);
        }
        notifyListeners(replaced);
    }

    private void retryPendingRestore() {
        final long gen;
        synchronized (lock) {
            if (!restorePending || state != SessionState.DISCONNECTED) {
                return;
            }
            restorePending = false;
            state = SessionState.RESTORING_SESSION;
            gen = ++generation;
        }
        LOG.debug("Retrying deferred wallet restore");
        restore(gen);
    }

    private Session authenticate(
            final WalletProviderAdapter adapter, final Address address, final long gen, final boolean lazyAllowed) {
        final String nonce = authClient.fetchNonce();
        if (BackendAuthClient.LAZY_AUTH_NONCE.equals(nonce)) {
            if (!lazyAllowed || !config.allowLazyAuth()) {
                throw new BackendAuthException("Backend asked to skip sign-in, but lazy authentication is disabled", 200);
            }
            final Session replaced;
            synchronized (lock) {
                requireCurrent(gen, adapter);
                state = SessionState.CONNECTED_UNAUTHENTICATED;
                replaced = replace(Session.connected(adapter.kind(), address));
            }
            LOG.info("Sign-in for {} deferred until first authenticated call", address);
            notifyListeners(replaced);
            return replaced;
        }
        final String message = new SignInMessage(
                config.domain(), address, config.statement(), config.uri(), config.chainId(), nonce, clock.instant())
                .render();
        final HexData signature = adapter.signMessage(message);
        return exchange(adapter, address, gen, new LoginRequest.SignedMessage(message, signature));
    }

    private Session exchange(
            final WalletProviderAdapter adapter, final Address address, final long gen, final LoginRequest request) {
        final String issued = authClient.login(request);
        if (!AuthTokens.isValidFormat(issued)) {
            throw new BackendAuthException("Backend issued a malformed session token", 200);
        }
        final AuthToken token = new AuthToken(issued, TokenStore.locationFor(adapter.kind()));
        final Session replaced;
        synchronized (lock) {
            requireCurrent(gen, adapter);
            tokenStore.save(token);
            state = SessionState.AUTHENTICATED;
            replaced = replace(Session.authenticated(adapter.kind(), address, token));
        }
        LOG.info("Authenticated {} wallet session for {}", adapter.name(), address);
        notifyListeners(replaced);
        return replaced;
    }

    private void rollback(final long gen, final WalletProviderAdapter adapter, final RuntimeException cause) {
        final Session replaced;
        final TransactionSubmitter staleSubmitter;
        final boolean superseded;
        synchronized (lock) {
            superseded = gen != generation;
            if (superseded) {
                replaced = null;
                staleSubmitter = null;
            } else {
                replaced = rollbackLocked(cause);
                staleSubmitter = dropCaches();
            }
        }
        if (superseded) {
            if (!isActive(adapter)) {
                disconnectAdapter(adapter);
            }
            return;
        }
        LOG.warn("Wallet session with {} rolled back: {}", adapter.name(), cause.getMessage());
        if (staleSubmitter != null) {
            staleSubmitter.reset();
        }
        disconnectAdapter(adapter);
        notifyListeners(replaced);
    }

    private @Nullable Session rollbackLocked(final RuntimeException cause) {
        generation++;
        final ErrorKind kind = cause instanceof ConduitException conduit ? conduit.kind() : null;
        state = cause instanceof BackendAuthException ? SessionState.DISCONNECTED : SessionState.ERROR;
        active = null;
        try {
            tokenStore.clear();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        return replace(kind != null ? Session.failed(kind) : Session.EMPTY);
    }

    private boolean isActive(final WalletProviderAdapter adapter) {
        synchronized (lock) {
            return active == adapter;
        }
    }

    private Address awaitAddress(final WalletProviderAdapter adapter) {
        final CompletableFuture<Address> pending = adapter.connect();
        try {
            return pending.get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new NotConnectedException("Wallet " + adapter.name() + " failed to connect", cause);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new NotConnectedException(
                    "Wallet " + adapter.name() + " did not connect within " + config.connectTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new NotConnectedException("Interrupted while connecting " + adapter.name(), e);
        }
    }

    private void ensureChain(final HybridRpcRouter connected) {
        final Long actual = connected.walletChainId();
        if (actual == null || actual == config.chainId()) {
            return;
        }
        LOG.info("Wallet is on chain {}; requesting switch to {}", actual, config.chainId());
        try {
            connected.switchWalletChain(config.chainId());
        } catch (ConduitException e) {
            throw new ChainMismatchException(config.chainId(), actual, e);
        }
        final Long switched = connected.walletChainId();
        if (switched != null && switched != config.chainId()) {
            throw new ChainMismatchException(config.chainId(), switched);
        }
    }

    private void requireCurrent(final long gen, final WalletProviderAdapter adapter) {
        if (gen != generation || active != adapter) {
            throw new NotConnectedException("Connect to " + adapter.name() + " was superseded");
        }
    }

    private HybridRpcRouter currentRouter() {
        if (active == null || !state.hasWallet()) {
            throw new NotConnectedException("No wallet connected (state " + state + ")");
        }
        if (router == null) {
            router = new HybridRpcRouter(active, trusted, config.readRetry());
        }
        return router;
    }

    private @Nullable TransactionSubmitter dropCaches() {
        final TransactionSubmitter stale = submitter;
        router = null;
        submitter = null;
        return stale;
    }

    private @Nullable Session replace(final Session next) {
        if (next.equals(session)) {
            return null;
        }
        session = next;
        return next;
    }

    private void notifyListeners(final @Nullable Session replaced) {
        if (replaced == null) {
            return;
        }
        for (SessionListener listener : listeners) {
            try {
                listener.onSessionReplaced(replaced);
            } catch (RuntimeException e) {
                LOG.warn("Session listener failed", e);
            }
        }
    }

    private static void disconnectAdapter(final WalletProviderAdapter adapter) {
        try {
            adapter.disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Disconnecting {} wallet failed", adapter.name(), e);
        }
    }

    public static final class Builder {
        private final SessionConfig config;
        private @Nullable RpcProvider trusted;
        private @Nullable BackendAuthClient authClient;
        private @Nullable TokenStore tokenStore;
        private @Nullable Clock clock;
        private @Nullable Sleeper sleeper;
        private final Map<ProviderKind, WalletProviderAdapter> adapters = new LinkedHashMap<>();

        private Builder(final SessionConfig config) {
            this.config = config;
        }

        /**
         * Endpoint that answers every chain read. Wallet-supplied read data is never used.
         */
        public Builder trustedRpc(final RpcProvider trusted) {
            this.trusted = trusted;
            return this;
        }

        public Builder authClient(final BackendAuthClient authClient) {
            this.authClient = authClient;
            return this;
        }

        public Builder tokenStore(final TokenStore tokenStore) {
            this.tokenStore = tokenStore;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(final Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Registers an adapter. Earlier registrations are preferred when restoring.
         */
        public Builder adapter(final WalletProviderAdapter adapter) {
            Objects.requireNonNull(adapter, "adapter");
            if (adapters.putIfAbsent(adapter.kind(), adapter) != null) {
                throw new IllegalArgumentException("adapter for " + adapter.kind() + " already registered");
            }
            return this;
        }

        public SessionManager build() {
            return new SessionManager(this);
        }
    }
}
