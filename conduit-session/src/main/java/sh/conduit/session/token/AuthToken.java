// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

import java.util.Objects;

/**
 * Opaque backend bearer credential and the location it is persisted to.
 * <p>
 * {@link #toString()} never includes the credential.
 */
public record AuthToken(String value, StorageLocation location) {

    public AuthToken {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(location, "location");
        if (value.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
    }

    public String bearer() {
        return "Bearer " + value;
    }

    @Override
    public String toString() {
        return "AuthToken[location=" + location + ", length=" + value.length() + "]";
    }
}
