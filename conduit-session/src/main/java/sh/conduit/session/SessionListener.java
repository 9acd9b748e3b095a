// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

/**
 * Notified once per wholesale session replacement, after the manager's lock is released.
 */
@FunctionalInterface
public interface SessionListener {

    void onSessionReplaced(Session session);
}
