// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.wallet.ProviderKind;

/**
 * Holds the backend auth token in memory and mirrors it to at most one persistent location.
 * <p>
 * Embedded (social login) sessions persist durably; every other wallet kind keeps the token
 * session-scoped. {@link #clear()} erases every location before it returns and tries every
 * location even when an earlier one fails.
 */
public final class TokenStore {

    private static final Logger LOG = LoggerFactory.getLogger(TokenStore.class);

    public static final String STORAGE_KEY = "auth_token";

    private final TokenStorage sessionStorage;
    private final TokenStorage durableStorage;
    private @Nullable AuthToken current;

    public TokenStore(final TokenStorage sessionStorage, final TokenStorage durableStorage) {
        this.sessionStorage = Objects.requireNonNull(sessionStorage, "sessionStorage");
        this.durableStorage = Objects.requireNonNull(durableStorage, "durableStorage");
    }

    /**
     * Store with no persistence beyond the process.
     */
    public static TokenStore inMemory() {
        return new TokenStore(
                new InMemoryTokenStorage(StorageLocation.SESSION),
                new InMemoryTokenStorage(StorageLocation.DURABLE));
    }

    public static StorageLocation locationFor(final ProviderKind kind) {
        return kind == ProviderKind.EMBEDDED ? StorageLocation.DURABLE : StorageLocation.SESSION;
    }

    /**
     * Keeps {@code token} in memory and at its own location, and removes any token left at the
     * other location.
     */
    public synchronized void save(final AuthToken token) {
        Objects.requireNonNull(token, "token");
        current = token;
        switch (token.location()) {
            case SESSION -> {
                sessionStorage.write(STORAGE_KEY, token.value());
                durableStorage.remove(STORAGE_KEY);
            }
            case DURABLE -> {
                durableStorage.write(STORAGE_KEY, token.value());
                sessionStorage.remove(STORAGE_KEY);
            }
            case MEMORY -> {
                sessionStorage.remove(STORAGE_KEY);
                durableStorage.remove(STORAGE_KEY);
            }
        }
    }

    /**
     * The in-memory token, else the first well-formed persisted one. A malformed persisted
     * token is removed.
     */
    public synchronized Optional<AuthToken> load() {
        if (current != null) {
            return Optional.of(current);
        }
        for (TokenStorage storage : List.of(sessionStorage, durableStorage)) {
            final Optional<String> stored = storage.read(STORAGE_KEY);
            if (stored.isEmpty()) {
                continue;
            }
            if (!AuthTokens.isValidFormat(stored.get())) {
                LOG.warn("Discarding malformed token from {} storage", storage.location());
                storage.remove(STORAGE_KEY);
                continue;
            }
            current = new AuthToken(stored.get(), storage.location());
            return Optional.of(current);
        }
        return Optional.empty();
    }

    public synchronized @Nullable AuthToken current() {
        return current;
    }

    /**
     * Erases the token from memory and every storage location.
     *
     * @throws IllegalStateException if any location could not be cleared, after all were tried;
     *                               the individual failures are attached as suppressed
     */
    public synchronized void clear() {
        current = null;
        final List<RuntimeException> failures = new ArrayList<>();
        for (TokenStorage storage : List.of(sessionStorage, durableStorage)) {
            try {
                storage.remove(STORAGE_KEY);
            } catch (RuntimeException e) {
                LOG.warn("Failed to clear token from {} storage", storage.location(), e);
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            final IllegalStateException error = new IllegalStateException(
                    "Token could not be cleared from " + failures.size() + " storage location(s)");
            failures.forEach(error::addSuppressed);
            throw error;
        }
    }
}
