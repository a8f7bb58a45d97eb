package com.myorg.hitl.store.jdbc;

import com.myorg.hitl.contracts.core.exception.TicketNotFoundException;
import com.myorg.hitl.contracts.ticket.NewTicket;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.ClaimQueue;
import com.myorg.hitl.store.TicketIntake;
import com.myorg.hitl.store.TicketStore;
import com.myorg.hitl.store.TicketTransitionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = HitlStoreITApp.class,
        properties = {
                "hitl.store.backend=jdbc",
                "hitl.store.claim-strategy=SKIP_LOCKED",
                "hitl.store.lease=200ms"
        }
)
class SkipLockedClaimTest extends PostgresContainerBase {

    @Autowired ClaimQueue queue;
    @Autowired TicketStore store;
    @Autowired TicketIntake intake;
    @Autowired TicketTransitionEngine engine;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        jdbc.update("TRUNCATE TABLE hitl_pending, hitl_drafted, hitl_escalated, hitl_completed, hitl_ticket_registry");
    }

    @Test
    void concurrentClaimers_shouldSkipLockedRowsAndNeverShare() throws Exception {
        for (int i = 0; i < 100; i++) {
            intake.raise(NewTicket.builder().ticketId(String.format("TKT_%04d", i)).issue("i" + i).build(),
                    TicketStage.PENDING);
        }

        Set<String> claimed = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int w = 0; w < 8; w++) {
            String owner = "worker-" + w;
            pool.submit(() -> {
                start.await();
                Optional<Ticket> t;
                while ((t = queue.claimNext(owner)).isPresent()) {
                    if (!claimed.add(t.get().getTicketId())) duplicates.add(t.get().getTicketId());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));

        assertTrue(duplicates.isEmpty(), "double claims: " + duplicates);
        assertEquals(100, claimed.size());
    }

    @Test
    void crashAfterClaim_thenLeaseExpiry_shouldLetAnotherWorkerClaim() throws Exception {
        intake.raise(NewTicket.builder().ticketId("TKT_CRASH").issue("stuck").build(), TicketStage.PENDING);
        queue.claimNext("crashed-worker").orElseThrow();
        assertTrue(queue.claimNext("w2").isEmpty());

        // wait lease expire
        Thread.sleep(250);
        assertEquals(1, queue.releaseExpiredClaims());

        Ticket t = queue.claimNext("w2").orElseThrow();
        assertEquals("TKT_CRASH", t.getTicketId());
        assertEquals(1, t.getDrafting().attempts());
    }

    @Test
    void racingApproveAndEscalate_shouldLeaveExactlyOneCopy() throws Exception {
        for (int round = 0; round < 20; round++) {
            String id = "TKT_RACE_" + round;
            intake.raise(NewTicket.builder().ticketId(id).issue("race").build(), TicketStage.PENDING);

            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Callable<Boolean> approve = () -> {
                    start.await();
                    return wins(() -> engine.approve(id, TicketStage.PENDING, "done"));
                };
                Callable<Boolean> escalate = () -> {
                    start.await();
                    return wins(() -> engine.escalate(id, TicketStage.PENDING, "why"));
                };
                Future<Boolean> a = pool.submit(approve);
                Future<Boolean> e = pool.submit(escalate);
                start.countDown();

                int winners = (a.get(10, TimeUnit.SECONDS) ? 1 : 0) + (e.get(10, TimeUnit.SECONDS) ? 1 : 0);
                assertEquals(1, winners);
            } finally {
                pool.shutdownNow();
            }

            int copies = 0;
            for (TicketStage s : TicketStage.values()) {
                if (store.findById(s, id).isPresent()) copies++;
            }
            assertEquals(1, copies);
        }
    }

    private static boolean wins(Runnable move) {
        try {
            move.run();
            return true;
        } catch (TicketNotFoundException e) {
            return false;
        }
    }
}
