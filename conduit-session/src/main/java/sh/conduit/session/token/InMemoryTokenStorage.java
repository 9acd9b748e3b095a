// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed storage. Used for the session-scoped location, which lives as long as the
 * process that owns it.
 */
public final class InMemoryTokenStorage implements TokenStorage {

    private final StorageLocation location;
    private final Map<String, String> values = new ConcurrentHashMap<>();

    public InMemoryTokenStorage(final StorageLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    @Override
    public StorageLocation location() {
        return location;
    }

    @Override
    public Optional<String> read(final String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void write(final String key, final String value) {
        values.put(key, value);
    }

    @Override
    public void remove(final String key) {
        values.remove(key);
    }
}
