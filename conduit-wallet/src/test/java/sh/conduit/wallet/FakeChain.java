// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sh.conduit.core.crypto.Keccak256;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.Wei;
import sh.conduit.primitives.Hex;
import sh.conduit.rpc.JsonRpcResponse;
import sh.conduit.rpc.RpcProvider;

/**
 * In-memory chain answering the trusted-endpoint methods. Transactions stay pending until
 * {@link #mine()} puts them in a new block.
 */
public final class FakeChain implements RpcProvider {

    public static final long CHAIN_ID = 8453L;

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Deque<RpcException>> failures = new HashMap<>();
    private final Map<String, Deque<RpcException>> failuresAfter = new HashMap<>();
    private final Map<Long, List<Hash>> blocks = new HashMap<>();
    private final Map<Hash, Tx> txs = new LinkedHashMap<>();
    private final List<Hash> mempool = new ArrayList<>();
    private final Set<Hash> reverting = new HashSet<>();
    private final Map<Address, Long> nextNonce = new HashMap<>();
    private final List<String> rawTransactions = new ArrayList<>();

    private long head;
    private Wei gasPrice = Wei.gwei(1);
    private long gasEstimate = 50_000L;
    private long hashCounter = 1;
    private Address rawSender;

    public FakeChain(final long head) {
        this.head = head;
    }

    public synchronized FakeChain gasPrice(final Wei price) {
        this.gasPrice = price;
        return this;
    }

    public synchronized FakeChain gasEstimate(final long estimate) {
        this.gasEstimate = estimate;
        return this;
    }

    public synchronized FakeChain nonce(final Address sender, final long next) {
        nextNonce.put(sender, next);
        return this;
    }

    /** Sender credited for {@code eth_sendRawTransaction} payloads. */
    public synchronized FakeChain rawSender(final Address sender) {
        this.rawSender = sender;
        return this;
    }

    public synchronized void failNext(final String method, final RpcException failure) {
        failures.computeIfAbsent(method, ignored -> new ArrayDeque<>()).add(failure);
    }

    /** Processes the next {@code method} call normally, then answers with {@code failure}. */
    public synchronized void failAfterNext(final String method, final RpcException failure) {
        failuresAfter.computeIfAbsent(method, ignored -> new ArrayDeque<>()).add(failure);
    }

    public synchronized void revert(final Hash hash) {
        reverting.add(hash);
    }

    /** Adds a pending transaction from {@code sender} at its next nonce. */
    public synchronized Hash broadcast(final Address sender) {
        return broadcast(sender, nextNonce.getOrDefault(sender, 0L));
    }

    public synchronized Hash broadcast(final Address sender, final long nonce) {
        return broadcast(new Hash(String.format("0x%064x", hashCounter++)), sender, nonce);
    }

    public synchronized Hash broadcast(final Hash hash, final Address sender, final long nonce) {
        txs.put(hash, new Tx(hash, sender, nonce));
        mempool.add(hash);
        nextNonce.merge(sender, nonce + 1, Math::max);
        return hash;
    }

    /** Records a transaction that is already mined in {@code block}. */
    public synchronized void mined(final Hash hash, final Address sender, final long nonce, final long block) {
        final Tx tx = new Tx(hash, sender, nonce);
        tx.block = block;
        txs.put(hash, tx);
        blocks.computeIfAbsent(block, ignored -> new ArrayList<>()).add(hash);
        head = Math.max(head, block);
    }

    /** Mines the mempool into a new block and returns its number. */
    public synchronized long mine() {
        head++;
        final List<Hash> included = new ArrayList<>(mempool);
        blocks.put(head, included);
        for (Hash hash : included) {
            txs.get(hash).block = head;
        }
        mempool.clear();
        return head;
    }

    public synchronized void emptyBlocks(final int count) {
        head += count;
    }

    public synchronized long head() {
        return head;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long count(final String method) {
        return calls().stream().filter(method::equals).count();
    }

    public synchronized List<String> rawTransactions() {
        return List.copyOf(rawTransactions);
    }

    @Override
    public synchronized JsonRpcResponse send(final String method, final List<?> params) {
        calls.add(method);
        final Deque<RpcException> queued = failures.get(method);
        if (queued != null && !queued.isEmpty()) {
            throw queued.poll();
        }
        final Object result = switch (method) {
            case "eth_chainId" -> quantity(CHAIN_ID);
            case "eth_blockNumber" -> quantity(head);
            case "eth_gasPrice" -> gasPrice.toHexString();
            case "eth_estimateGas" -> quantity(gasEstimate);
            case "eth_getTransactionCount" -> quantity(count(new Address(params.get(0).toString()),
                    params.get(1).toString()));
            case "eth_getBlockByNumber" -> block(Long.decode(params.get(0).toString()));
            case "eth_getTransactionByHash" -> transaction(new Hash(params.get(0).toString()));
            case "eth_getTransactionReceipt" -> receipt(new Hash(params.get(0).toString()));
            case "eth_sendRawTransaction" -> sendRaw(params.get(0).toString());
            default -> throw new RpcException(RpcException.METHOD_NOT_FOUND_CODE, "method not found: " + method);
        };
        final Deque<RpcException> after = failuresAfter.get(method);
        if (after != null && !after.isEmpty()) {
            throw after.poll();
        }
        return JsonRpcResponse.ofResult(result);
    }

    private long count(final Address sender, final String tag) {
        if ("pending".equals(tag)) {
            return nextNonce.getOrDefault(sender, 0L);
        }
        return txs.values().stream().filter(tx -> tx.from.equals(sender) && tx.block != null).count();
    }

    private Object block(final long number) {
        if (number > head) {
            return null;
        }
        final List<Hash> hashes = blocks.getOrDefault(number, List.of());
        final Map<String, Object> block = new LinkedHashMap<>();
        block.put("number", quantity(number));
        block.put("hash", String.format("0x%064x", 0xb10c0000L + number));
        block.put("transactions", hashes.stream().map(Hash::value).toList());
        return block;
    }

    private Object transaction(final Hash hash) {
        final Tx tx = txs.get(hash);
        if (tx == null) {
            return null;
        }
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("hash", tx.hash.value());
        map.put("from", tx.from.value());
        map.put("to", null);
        map.put("nonce", quantity(tx.nonce));
        map.put("blockNumber", tx.block != null ? quantity(tx.block) : null);
        return map;
    }

    private Object receipt(final Hash hash) {
        final Tx tx = txs.get(hash);
        if (tx == null || tx.block == null) {
            return null;
        }
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("transactionHash", tx.hash.value());
        map.put("blockNumber", quantity(tx.block));
        map.put("from", tx.from.value());
        map.put("status", reverting.contains(hash) ? "0x0" : "0x1");
        return map;
    }

    private Object sendRaw(final String raw) {
        if (rawSender == null) {
            throw new IllegalStateException("rawSender not configured");
        }
        rawTransactions.add(raw);
        final Hash hash = Hash.fromBytes(Keccak256.hash(Hex.decode(raw)));
        broadcast(hash, rawSender, nextNonce.getOrDefault(rawSender, 0L));
        return hash.value();
    }

    private static String quantity(final long value) {
        return "0x" + Long.toHexString(value);
    }

    private static final class Tx {
        private final Hash hash;
        private final Address from;
        private final long nonce;
        private Long block;

        Tx(final Hash hash, final Address from, final long nonce) {
            this.hash = hash;
            this.from = from;
            this.nonce = nonce;
        }
    }
}
