// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.token;

/**
 * Where an auth token lives between process restarts.
 */
public enum StorageLocation {
    /** Held only by the running process. */
    MEMORY,
    /** Survives a reload of the current session but not a new one. */
    SESSION,
    /** Survives restarts until explicitly cleared. */
    DURABLE
}
