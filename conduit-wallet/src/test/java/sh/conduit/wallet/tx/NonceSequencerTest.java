// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet.tx;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.conduit.core.error.TransactionTimeoutException;
import sh.conduit.core.types.Address;
import sh.conduit.rpc.ChainReader;
import sh.conduit.rpc.RpcRetryConfig;
import sh.conduit.wallet.FakeChain;

class NonceSequencerTest {

    private static final Address SENDER = new Address("0xc9d0602a87e55116f633b1a1f95d083eb115f942");
    private static final Address OTHER = new Address("0x1936cad0b758ad8f83ca392ac9138ff2b4ab0b05");

    private FakeChain chain;
    private NonceSequencer sequencer;

    @BeforeEach
    void setUp() {
        chain = new FakeChain(10L).nonce(SENDER, 100L).nonce(OTHER, 7L);
        sequencer = new NonceSequencer(new ChainReader(chain, RpcRetryConfig.builder()
                .backoffBaseMs(1).backoffMaxMs(2).build()));
    }

    @Test
    void firstReservationUsesPendingCount() {
        NonceLease lease = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        assertEquals(100L, lease.nonce());
        assertEquals(Long.valueOf(100L), sequencer.inFlight(SENDER));
    }

    @Test
    void nextReservationWaitsForConfirmation() throws Exception {
        // Given: step K holds nonce 100
        NonceLease first = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        // When: step K+1 asks for a nonce
        CompletableFuture<NonceLease> second = CompletableFuture.supplyAsync(
                () -> sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(5))));

        // Then: it is not issued until step K is settled
        Thread.sleep(100);
        assertFalse(second.isDone());
        first.confirm();
        assertEquals(101L, second.get(5, TimeUnit.SECONDS).nonce());
    }

    @Test
    void laggingNodeCannotRewindConfirmedNonce() {
        NonceLease first = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));
        first.confirm();

        // The node still reports 100 as the next pending nonce
        NonceLease second = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        assertEquals(101L, second.nonce());
    }

    @Test
    void networkAheadOfLocalStateWins() {
        sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).confirm();
        chain.nonce(SENDER, 110L);

        assertEquals(110L, sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).nonce());
    }

    @Test
    void failedLeaseRereadsNetwork() {
        sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).confirm();
        NonceLease unused = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));
        assertEquals(101L, unused.nonce());

        unused.fail();

        assertEquals(100L, sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).nonce());
    }

    @Test
    void busyLaneTimesOut() {
        sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        assertThrows(TransactionTimeoutException.class,
                () -> sequencer.reserve(SENDER, Deadline.after(Duration.ofMillis(50))));
    }

    @Test
    void overrideLetsNextStepProceed() {
        NonceLease stuck = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        assertTrue(stuck.override());

        assertEquals(101L, sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).nonce());
    }

    @Test
    void leaseReleasesOnlyOnce() {
        NonceLease lease = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));

        assertTrue(lease.confirm());
        assertFalse(lease.fail());
        assertFalse(lease.override());
        assertTrue(lease.isReleased());
        assertNull(sequencer.inFlight(SENDER));
    }

    @Test
    void sendersAreIndependent() {
        NonceLease mine = sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));
        NonceLease theirs = sequencer.reserve(OTHER, Deadline.after(Duration.ofMillis(50)));

        assertEquals(100L, mine.nonce());
        assertEquals(7L, theirs.nonce());
    }

    @Test
    void invalidateTrustsNetworkAgain() {
        sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).confirm();

        sequencer.invalidate(SENDER);

        assertEquals(100L, sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1))).nonce());
    }

    @Test
    void clearWakesBlockedReservation() throws Exception {
        sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(1)));
        CompletableFuture<NonceLease> waiting = CompletableFuture.supplyAsync(
                () -> sequencer.reserve(SENDER, Deadline.after(Duration.ofSeconds(5))));
        Thread.sleep(100);

        sequencer.clear();

        assertEquals(100L, waiting.get(5, TimeUnit.SECONDS).nonce());
    }
}
