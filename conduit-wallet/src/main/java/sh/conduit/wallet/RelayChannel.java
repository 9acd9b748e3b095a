// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.List;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.conduit.core.error.RpcException;
import sh.conduit.core.types.Address;

/**
 * Wallet-connect style pairing channel. Account changes arrive as events rather than return
 * values.
 */
public interface RelayChannel {

    /**
     * Starts pairing. Events for this pairing go to {@code listener} until the next
     * {@code open} or {@link #close()}.
     */
    void open(Listener listener);

    /**
     * @throws RpcException for relay or wallet-side errors
     */
    @Nullable Object request(String method, List<?> params) throws RpcException;

    void close();

    /**
     * @return false while a previously paired session is still being restored
     */
    boolean restoreComplete();

    Optional<Address> restoredAccount();

    interface Listener {

        void onAccountsChanged(List<Address> accounts);

        void onDisconnect(String reason);
    }
}
