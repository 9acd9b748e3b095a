// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.TransactionNotFoundException;
import sh.conduit.core.error.TransactionRevertedException;
import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.rpc.ChainReader;
import sh.conduit.rpc.RpcRetryConfig;
import sh.conduit.wallet.FakeChain;
import sh.conduit.wallet.MutableClock;

class HashReconcilerTest {

    private static final Address USER = new Address("0xc9d0602a87e55116f633b1a1f95d083eb115f942");
    private static final Address STRANGER = new Address("0x1936cad0b758ad8f83ca392ac9138ff2b4ab0b05");
    private static final Hash WRONG_HASH =
            new Hash("0xd676b974bef5f2a5615273c0d25c6f2a2111f1ff181d09a1651cd78f553dde57");
    private static final Hash CORRECT_HASH =
            new Hash("0x6b7c3963b7d1453deb4952db1ec38f06f0af2cd0fa013c95b0d8b8727cb795b9");
    private static final long MINED_AT = 0x236cc00L;
    private static final long USER_NONCE = 35L;

    private final MutableClock clock = new MutableClock();
    private final AtomicInteger sleeps = new AtomicInteger();
    private FakeChain chain;
    private Runnable onSleep;

    @BeforeEach
    void setUp() {
        chain = new FakeChain(MINED_AT - 1);
        // The decoy is a real transaction from someone else, mined long ago
        chain.mined(WRONG_HASH, STRANGER, 0x188L, 0x2300000L);
        onSleep = () -> { };
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(HashReconciler.class)).detachAndStopAllAppenders();
    }

    private HashReconciler reconciler(final RetryPolicy policy) {
        ChainReader reader = new ChainReader(chain, RpcRetryConfig.builder().backoffBaseMs(1).backoffMaxMs(2).build());
        Sleeper sleeper = duration -> {
            clock.advance(duration);
            sleeps.incrementAndGet();
            onSleep.run();
        };
        return new HashReconciler(reader, policy, sleeper);
    }

    private PendingTransaction pendingWith(final Hash claimed) {
        return new PendingTransaction(USER, USER_NONCE, claimed, MINED_AT - 1);
    }

    @Test
    void wrongWalletHashIsReplacedByMinedHash() {
        // Given: the wallet returned another account's hash and ours mines during the first pause
        PendingTransaction pending = pendingWith(WRONG_HASH);
        onSleep = () -> chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);

        // When
        Hash confirmed = reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock));

        // Then
        assertEquals(CORRECT_HASH, confirmed);
        assertNotEquals(WRONG_HASH, confirmed);
        assertEquals(TxStatus.CONFIRMED, pending.status());
        assertEquals(CORRECT_HASH, pending.confirmedHash());
    }

    @Test
    void decoyIsReportedOnce() {
        // Given
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(HashReconciler.class)).addAppender(appender);
        PendingTransaction pending = pendingWith(WRONG_HASH);
        onSleep = () -> {
            if (sleeps.get() == 2) {
                chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);
            }
        };

        // When
        reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock));

        // Then: one warning for the decoy, one for the corrected hash
        long decoyWarnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .filter(event -> event.getFormattedMessage().contains("belongs to " + STRANGER))
                .count();
        assertEquals(1, decoyWarnings);
        assertTrue(appender.list.stream()
                .anyMatch(event -> event.getFormattedMessage().contains("but the chain mined " + CORRECT_HASH)));
    }

    @Test
    void matchingWalletHashSkipsBlockScan() {
        chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);
        PendingTransaction pending = pendingWith(CORRECT_HASH);

        Hash confirmed = reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock));

        assertEquals(CORRECT_HASH, confirmed);
        assertEquals(0, chain.count("eth_getBlockByNumber"));
        assertEquals(0, sleeps.get());
    }

    @Test
    void keepsSearchingAcrossRounds() {
        // Given: the transaction only mines after the third pause
        PendingTransaction pending = pendingWith(WRONG_HASH);
        onSleep = () -> {
            if (sleeps.get() == 3) {
                chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);
            }
        };

        // When
        Hash confirmed = reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(2), clock));

        // Then
        assertEquals(CORRECT_HASH, confirmed);
        assertEquals(3, sleeps.get());
    }

    @Test
    void searchNeverGoesBelowSubmissionHead() {
        // Given: a transaction matching (from, nonce) sits below the head observed at dispatch
        chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT - 50);
        PendingTransaction pending = pendingWith(WRONG_HASH);
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(2).build();

        // Then
        assertThrows(TransactionNotFoundException.class,
                () -> reconciler(policy).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock)));
    }

    @Test
    void exhaustionNeverFallsBackToWalletHash() {
        PendingTransaction pending = pendingWith(WRONG_HASH);
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        TransactionNotFoundException ex = assertThrows(TransactionNotFoundException.class,
                () -> reconciler(policy).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock)));

        assertEquals(USER, ex.sender());
        assertEquals(USER_NONCE, ex.nonce());
        assertNotEquals(TxStatus.CONFIRMED, pending.status());
        assertNull(pending.confirmedHash());
    }

    @Test
    void deadlineEndsSearchAsUnknown() {
        PendingTransaction pending = pendingWith(WRONG_HASH);

        TransactionTimeoutException ex = assertThrows(TransactionTimeoutException.class,
                () -> reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofSeconds(3), clock)));

        assertEquals(WRONG_HASH, ex.hash());
        assertEquals(TxStatus.UNKNOWN, pending.status());
    }

    @Test
    void transientReadErrorDoesNotAbortSearch() {
        chain.failNext("eth_getTransactionByHash", new RpcException(-32000, "boom"));
        chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);
        PendingTransaction pending = pendingWith(CORRECT_HASH);

        Hash confirmed = reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock));

        assertEquals(CORRECT_HASH, confirmed);
        assertEquals(1, sleeps.get());
    }

    @Test
    void revertedTransactionFails() {
        chain.mined(CORRECT_HASH, USER, USER_NONCE, MINED_AT);
        chain.revert(CORRECT_HASH);
        PendingTransaction pending = pendingWith(WRONG_HASH);

        TransactionRevertedException ex = assertThrows(TransactionRevertedException.class,
                () -> reconciler(RetryPolicy.defaults()).reconcile(pending, Deadline.after(Duration.ofMinutes(1), clock)));

        assertEquals(CORRECT_HASH, ex.hash());
        assertEquals(TxStatus.FAILED, pending.status());
    }
}
