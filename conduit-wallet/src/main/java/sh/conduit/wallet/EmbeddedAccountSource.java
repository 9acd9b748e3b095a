// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import sh.conduit.core.crypto.PrivateKey;

/**
 * Social-login SDK boundary. Hands over the account key once the user has logged in or a
 * previous login has been restored.
 */
public interface EmbeddedAccountSource {

    /**
     * @return false while the SDK is still restoring a previous login in the background
     */
    boolean restoreComplete();

    Optional<PrivateKey> restored();

    CompletableFuture<PrivateKey> login();

    default void logout() {
    }
}
