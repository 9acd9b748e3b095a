// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * Wallet that broadcasts into a {@link FakeChain} and can be told to misbehave: return a decoy
 * hash, or fail the next send.
 */
public final class ScriptedWallet implements WalletProviderAdapter {

    private final FakeChain chain;
    private final Address address;
    private final Deque<Hash> decoys = new ArrayDeque<>();
    private final Map<Long, Hash> decoysByNonce = new HashMap<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final Deque<RuntimeException> failuresAfterBroadcast = new ArrayDeque<>();
    private final List<TransactionRequest> sent = Collections.synchronizedList(new ArrayList<>());

    public ScriptedWallet(final FakeChain chain, final Address address) {
        this.chain = chain;
        this.address = address;
    }

    public synchronized ScriptedWallet returnDecoyNext(final Hash decoy) {
        decoys.add(decoy);
        return this;
    }

    /** Answers with {@code decoy} when asked to send at {@code nonce}. */
    public synchronized ScriptedWallet returnDecoyAt(final long nonce, final Hash decoy) {
        decoysByNonce.put(nonce, decoy);
        return this;
    }

    public synchronized ScriptedWallet failNext(final RuntimeException failure) {
        failures.add(failure);
        return this;
    }

    /** Broadcasts the next send, then answers with {@code failure} instead of the hash. */
    public synchronized ScriptedWallet broadcastThenFail(final RuntimeException failure) {
        failuresAfterBroadcast.add(failure);
        return this;
    }

    public List<TransactionRequest> sent() {
        synchronized (sent) {
            return List.copyOf(sent);
        }
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.INJECTED;
    }

    @Override
    public WalletCapabilities capabilities() {
        return WalletCapabilities.of(WalletCapability.SIGN_MESSAGE, WalletCapability.SEND_TRANSACTION);
    }

    @Override
    public CompletableFuture<Address> connect() {
        return CompletableFuture.completedFuture(address);
    }

    @Override
    public ProviderReadiness readiness() {
        return ProviderReadiness.READY_CONNECTED;
    }

    @Override
    public Address getAddress() {
        return address;
    }

    @Override
    public synchronized Hash sendTransaction(final TransactionRequest request) {
        sent.add(request);
        if (!failures.isEmpty()) {
            throw failures.poll();
        }
        final Hash real = chain.broadcast(address, request.nonce());
        if (!failuresAfterBroadcast.isEmpty()) {
            throw failuresAfterBroadcast.poll();
        }
        final Hash decoy = decoysByNonce.remove(request.nonce());
        if (decoy != null) {
            return decoy;
        }
        return decoys.isEmpty() ? real : decoys.poll();
    }

    @Override
    public void disconnect() {
    }
}
