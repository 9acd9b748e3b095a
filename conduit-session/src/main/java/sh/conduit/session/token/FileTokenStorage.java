// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Durable storage in a single JSON file. Writes go to a sibling temp file that is then moved
 * over the original, so a crash never leaves a half-written token behind.
 */
public final class FileTokenStorage implements TokenStorage {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;

    public FileTokenStorage(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public StorageLocation location() {
        return StorageLocation.DURABLE;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Optional<String> read(final String key) {
        return Optional.ofNullable(load().get(key));
    }

    @Override
    public synchronized void write(final String key, final String value) {
        final Map<String, String> entries = load();
        entries.put(key, value);
        store(entries);
    }

    @Override
    public synchronized void remove(final String key) {
        final Map<String, String> entries = load();
        if (entries.remove(key) != null) {
            store(entries);
        }
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(file.toFile(), ENTRIES);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read token file " + file, e);
        }
    }

    private void store(final Map<String, String> entries) {
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writeValue(temp.toFile(), entries);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write token file " + file, e);
        }
    }
}
