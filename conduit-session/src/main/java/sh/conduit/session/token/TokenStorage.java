// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.util.Optional;

/**
 * One client-side key-value store that may hold the auth token.
 */
public interface TokenStorage {

    StorageLocation location();

    Optional<String> read(String key);

    void write(String key, String value);

    void remove(String key);
}
