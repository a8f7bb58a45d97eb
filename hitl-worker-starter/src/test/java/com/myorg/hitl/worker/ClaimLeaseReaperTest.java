package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ClaimLeaseReaperTest {

    /** Simulates the process dying between claim and rollback. */
    static class SimulatedCrash extends Error {
        SimulatedCrash() {
            super("worker killed");
        }
    }

    @Test
    void crashedWorkerClaim_shouldBeReleasedAfterLeaseExpires() {
        WorkerFixture f = new WorkerFixture(Duration.ofMillis(200));
        f.pending("TKT_0001");

        DraftingWorkerHooks crash = new DraftingWorkerHooks() {
            @Override
            public void afterClaim(Ticket claimed) {
                throw new SimulatedCrash();
            }
        };
        assertThrows(SimulatedCrash.class, () -> f.worker("w1", WorkerFixture.echoGenerator(), crash).runOnce());

        // claimed and stuck: nobody else can take it
        assertEquals(0, f.store.countEligible());
        assertEquals(PollOutcome.IDLE, f.worker("w2", WorkerFixture.echoGenerator(), null).runOnce());

        ClaimLeaseReaper reaper = new ClaimLeaseReaper(f.store);
        await().atMost(Duration.ofSeconds(5)).until(() -> reaper.reap() == 1);

        Ticket t = f.store.findById(TicketStage.PENDING, "TKT_0001").orElseThrow();
        assertFalse(t.isDrafted());
        assertEquals(1, t.getDrafting().attempts());
        assertEquals("claim lease expired", t.getDrafting().lastError());

        assertEquals(PollOutcome.DRAFTED, f.worker("w2", WorkerFixture.echoGenerator(), null).runOnce());
    }

    @Test
    void liveClaims_areLeftAlone() {
        WorkerFixture f = new WorkerFixture(Duration.ofMinutes(5));
        f.pending("TKT_0002");
        f.store.claimNext("w1").orElseThrow();

        assertEquals(0, new ClaimLeaseReaper(f.store).reap());
    }

    @Test
    void workerWhoseLeaseWasReaped_mustNotPersistDraftOverNewOwner() {
        WorkerFixture f = new WorkerFixture(Duration.ofMillis(100));
        f.pending("TKT_0003");
        ClaimLeaseReaper reaper = new ClaimLeaseReaper(f.store);

        DraftingWorkerHooks slowDraft = new DraftingWorkerHooks() {
            @Override
            public void beforeDraft(Ticket claimed) {
                await().atMost(Duration.ofSeconds(5)).until(() -> reaper.reap() == 1);
                assertTrue(f.store.claimNext("w2").isPresent());
            }
        };

        assertEquals(PollOutcome.SUPERSEDED, f.worker("w1", WorkerFixture.echoGenerator(), slowDraft).runOnce());

        Ticket t = f.store.findById(TicketStage.PENDING, "TKT_0003").orElseThrow();
        assertTrue(t.isDrafted());
        assertEquals("w2", t.getDrafting().claimOwner());
        assertEquals(0, f.count(TicketStage.DRAFTED));
        assertEquals(0.0, f.counter("hitl.worker.drafted"));
    }

    @Test
    void failureAfterLosingClaim_shouldLeaveNewOwnersClaimAlone() {
        WorkerFixture f = new WorkerFixture(Duration.ofMillis(100));
        f.pending("TKT_0004");
        ClaimLeaseReaper reaper = new ClaimLeaseReaper(f.store);

        DraftingWorkerHooks slowDraft = new DraftingWorkerHooks() {
            @Override
            public void beforeDraft(Ticket claimed) {
                await().atMost(Duration.ofSeconds(5)).until(() -> reaper.reap() == 1);
                assertTrue(f.store.claimNext("w2").isPresent());
            }
        };
        DraftingWorker w1 = f.worker("w1", req -> { throw new ConnectivityException("completion service timed out"); }, slowDraft);

        assertEquals(PollOutcome.SUPERSEDED, w1.runOnce());

        Ticket t = f.store.findById(TicketStage.PENDING, "TKT_0004").orElseThrow();
        assertEquals("w2", t.getDrafting().claimOwner());
        assertEquals(1, t.getDrafting().attempts());
        assertEquals(0.0, f.counter("hitl.worker.released"));
        assertEquals(1.0, f.counter("hitl.worker.superseded"));
    }
}
