package com.myorg.hitl.store.memory;

import com.myorg.hitl.contracts.core.exception.DuplicateTicketException;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTicketStoreTest {

    private MutableClock clock;
    private InMemoryTicketStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        store = new InMemoryTicketStore(clock, Duration.ofSeconds(30));
    }

    @Test
    void claimNext_shouldTakeOldestFirst_andSkipClaimed() {
        pending("TKT_B", Instant.parse("2024-05-01T07:00:00Z"));
        pending("TKT_A", Instant.parse("2024-05-01T06:00:00Z"));

        Ticket first = store.claimNext("w1").orElseThrow();
        Ticket second = store.claimNext("w2").orElseThrow();

        assertEquals("TKT_A", first.getTicketId());
        assertEquals("TKT_B", second.getTicketId());
        assertTrue(first.isDrafted());
        assertEquals("w1", first.getDrafting().claimOwner());
        assertEquals(clock.instant().plusSeconds(30), first.getDrafting().leaseUntil());
        assertTrue(store.claimNext("w3").isEmpty());
        assertEquals(0, store.countEligible());
    }

    @Test
    void concurrentClaimers_shouldNeverShareATicket() throws Exception {
        for (int i = 0; i < 200; i++) {
            pending(String.format("TKT_%04d", i), clock.instant().minusSeconds(1000 - i));
        }

        Set<String> claimed = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new java.util.concurrent.CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int w = 0; w < 8; w++) {
            String owner = "w" + w;
            pool.submit(() -> {
                start.await();
                Optional<Ticket> t;
                while ((t = store.claimNext(owner)).isPresent()) {
                    if (!claimed.add(t.get().getTicketId())) duplicates.add(t.get().getTicketId());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertTrue(duplicates.isEmpty(), "double claims: " + duplicates);
        assertEquals(200, claimed.size());
    }

    @Test
    void release_shouldReEnableClaim_andCountAttempt() {
        pending("TKT_0001", clock.instant());
        store.claimNext("w1").orElseThrow();

        assertFalse(store.release("TKT_0001", "someone-else", "nope"));
        assertTrue(store.release("TKT_0001", "w1", "LLM timeout"));

        Ticket again = store.claimNext("w2").orElseThrow();
        assertEquals("TKT_0001", again.getTicketId());
        assertEquals(1, again.getDrafting().attempts());
        assertEquals("LLM timeout", again.getDrafting().lastError());
    }

    @Test
    void abandon_shouldReEnableClaim_withoutCountingAttempt() {
        pending("TKT_0002", clock.instant());
        store.claimNext("w1").orElseThrow();

        assertFalse(store.abandon("TKT_0002", "w2"));
        assertTrue(store.abandon("TKT_0002", "w1"));

        Ticket again = store.claimNext("w2").orElseThrow();
        assertEquals(0, again.getDrafting().attempts());
    }

    @Test
    void expiredLease_shouldBeReleasedByReaper() {
        pending("TKT_0002", clock.instant());
        store.claimNext("crashed-worker").orElseThrow();

        assertEquals(0, store.releaseExpiredClaims());
        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, store.releaseExpiredClaims());

        Ticket t = store.findById(TicketStage.PENDING, "TKT_0002").orElseThrow();
        assertFalse(t.isDrafted());
        assertEquals("claim lease expired", t.getDrafting().lastError());
        assertTrue(store.claimNext("w2").isPresent());
    }

    @Test
    void needsAttention_shouldParkTicketUntilRetried() {
        pending("TKT_0003", clock.instant());
        store.claimNext("w1").orElseThrow();

        assertTrue(store.markNeedsAttention("TKT_0003", "w1", "unparseable draft"));
        assertTrue(store.claimNext("w1").isEmpty());
        assertEquals(List.of("TKT_0003"),
                store.listNeedsAttention(10).stream().map(Ticket::getTicketId).toList());

        assertTrue(store.retryDraft("TKT_0003"));
        assertFalse(store.retryDraft("TKT_0003"));
        Ticket t = store.claimNext("w1").orElseThrow();
        assertEquals(0, t.getDrafting().attempts());
        assertTrue(store.listNeedsAttention(10).isEmpty());
    }

    @Test
    void create_shouldEnforceIdUniquenessAcrossStores() {
        pending("TKT_0004", clock.instant());
        Ticket dup = Ticket.builder().ticketId("TKT_0004").issue("again")
                .resolution("r")
                .metadata(TicketMetadata.builder().createdAt(clock.instant()).closedAt(clock.instant()).build())
                .build();

        assertThrows(DuplicateTicketException.class, () -> store.create(TicketStage.COMPLETED, dup));
        assertEquals(Optional.of(TicketStage.PENDING), store.locate("TKT_0004"));
    }

    @Test
    void listRecent_shouldReturnNewestFirst() {
        pending("TKT_OLD", Instant.parse("2024-04-01T00:00:00Z"));
        pending("TKT_NEW", Instant.parse("2024-04-30T00:00:00Z"));

        assertEquals(List.of("TKT_NEW", "TKT_OLD"),
                store.listRecent(TicketStage.PENDING, 5).stream().map(Ticket::getTicketId).toList());
        assertEquals(1, store.listRecent(TicketStage.PENDING, 1).size());
    }

    @Test
    void transactionOperations_shouldUndoMutationsOnFailure() {
        pending("TKT_0005", clock.instant());

        assertThrows(IllegalStateException.class, () -> store.transactionOperations().executeWithoutResult(s -> {
            store.findAndDelete(TicketStage.PENDING, "TKT_0005");
            throw new IllegalStateException("boom");
        }));

        assertTrue(store.findById(TicketStage.PENDING, "TKT_0005").isPresent());
    }

    private void pending(String id, Instant createdAt) {
        store.create(TicketStage.PENDING, Ticket.builder()
                .ticketId(id)
                .issue("issue " + id)
                .metadata(TicketMetadata.builder().createdAt(createdAt).build())
                .build());
    }
}
