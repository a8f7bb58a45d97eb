package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.core.exception.TicketStoreException;
import com.myorg.hitl.store.ClaimQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Returns tickets whose drafting claim outlived its lease (worker crashed or hung) to the
 * eligible pool.
 */
@Slf4j
@RequiredArgsConstructor
public class ClaimLeaseReaper {

    private final ClaimQueue queue;

    @Scheduled(
            initialDelayString = "#{@hitlWorkerSchedule.reaperInitialDelayMs}",
            fixedDelayString = "#{@hitlWorkerSchedule.reaperIntervalMs}"
    )
    public void scheduledReap() {
        try {
            reap();
        } catch (TicketStoreException e) {
            log.warn("Lease reaper skipped a round: {}", e.getMessage());
        }
    }

    public int reap() {
        return queue.releaseExpiredClaims();
    }
}
