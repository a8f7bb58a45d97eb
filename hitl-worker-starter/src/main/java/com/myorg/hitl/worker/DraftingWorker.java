package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.core.exception.HitlException;
import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.DraftResult;
import com.myorg.hitl.contracts.drafting.RetrievalContext;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.drafting.DraftGenerator;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.store.ClaimQueue;
import com.myorg.hitl.store.TicketTransitionEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One drafting loop body: claim, retrieve, draft, persist. Holds no state shared with other
 * workers; the claim queue is the only coordination point.
 */
@Slf4j
public class DraftingWorker {

    private final String workerId;
    private final ClaimQueue queue;
    private final RetrievalContextBuilder retrieval;
    private final DraftGenerator generator;
    private final TicketTransitionEngine transitions;
    private final HitlWorkerProperties props;
    private final Clock clock;
    private final DraftingWorkerHooks hooks;
    private final DraftingMetrics metrics; // may be null

    private volatile boolean stopRequested;

    public DraftingWorker(String workerId,
                          ClaimQueue queue,
                          RetrievalContextBuilder retrieval,
                          DraftGenerator generator,
                          TicketTransitionEngine transitions,
                          HitlWorkerProperties props,
                          Clock clock,
                          DraftingWorkerHooks hooks,
                          DraftingMetrics metrics) {
        this.workerId = workerId;
        this.queue = queue;
        this.retrieval = retrieval;
        this.generator = generator;
        this.transitions = transitions;
        this.props = props;
        this.clock = clock;
        this.hooks = hooks == null ? new DraftingWorkerHooks() {} : hooks;
        this.metrics = metrics;
    }

    public String workerId() {
        return workerId;
    }

    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public PollOutcome runOnce() {
        if (stopRequested) return PollOutcome.CANCELLED;

        Optional<Ticket> claim;
        try {
            claim = queue.claimNext(workerId);
        } catch (RuntimeException e) {
            log.warn("Claim failed on {}: {}", workerId, e.getMessage());
            return PollOutcome.STORE_ERROR;
        }
        if (claim.isEmpty()) return PollOutcome.IDLE;

        Ticket ticket = claim.get();
        Instant claimedAt = clock.instant();
        if (metrics != null) metrics.incClaimed();

        TicketMdc.put(ticket.getTicketId(), TicketStage.PENDING, workerId);
        try {
            return draft(ticket, claimedAt);
        } finally {
            TicketMdc.clear();
        }
    }

    private PollOutcome draft(Ticket ticket, Instant claimedAt) {
        String id = ticket.getTicketId();
        try {
            hooks.afterClaim(ticket);
            if (stopRequested) return abandon(id);

            RetrievalContext ctx = retrieval.build(ticket.getIssue());
            if (stopRequested) return abandon(id);

            hooks.beforeDraft(ticket);
            DraftResult result = generator.draft(DraftRequest.of(id, ticket.getIssue(), ctx));

            transitions.recordDraft(id, workerId, result);
            if (metrics != null) {
                metrics.incDrafted();
                metrics.recordDraft(Duration.between(claimedAt, clock.instant()));
            }
            log.info("Drafted ticket {} (confidence={}, policy={})", id, result.confidence(), result.usedPolicy());
            return PollOutcome.DRAFTED;

        } catch (RuntimeException e) {
            return onFailure(ticket, e);
        }
    }

    private PollOutcome onFailure(Ticket ticket, RuntimeException e) {
        String id = ticket.getTicketId();
        int attempts = ticket.draftingOrDefault().attempts();
        String err = DraftFailureClassifier.describe(e);

        try {
            switch (DraftFailureClassifier.decide(e, attempts, props.getMaxAttempts())) {
                case DROP -> {
                    if (metrics != null) metrics.incSuperseded();
                    log.info("Ticket {} was moved by a reviewer while drafting; draft dropped", id);
                    return PollOutcome.SUPERSEDED;
                }
                case RELEASE -> {
                    if (!queue.release(id, workerId, err)) return claimLost(id);
                    if (metrics != null) metrics.incReleased();
                    log.warn("Draft RETRY ticket={} attempt={} kind={}: {}",
                            id, attempts + 1, DraftFailureClassifier.kindOf(e), e.getMessage());
                    return PollOutcome.RELEASED;
                }
                default -> {
                    if (!queue.markNeedsAttention(id, workerId, err)) return claimLost(id);
                    if (metrics != null) metrics.incNeedsAttention();
                    if (e instanceof HitlException he && he.isRetryable()) {
                        log.warn("Draft NEEDS_ATTENTION ticket={} after attempts={}", id, attempts + 1, e);
                    } else {
                        log.warn("Draft NEEDS_ATTENTION ticket={} kind={}", id, DraftFailureClassifier.kindOf(e), e);
                    }
                    return PollOutcome.NEEDS_ATTENTION;
                }
            }
        } catch (RuntimeException rollback) {
            // the lease reaper gets this ticket back later
            rollback.addSuppressed(e);
            log.warn("Could not roll back claim on ticket {}", id, rollback);
            return PollOutcome.STORE_ERROR;
        }
    }

    private PollOutcome claimLost(String id) {
        if (metrics != null) metrics.incSuperseded();
        log.info("Claim on ticket {} no longer held by {}; leaving it to its current owner", id, workerId);
        return PollOutcome.SUPERSEDED;
    }

    private PollOutcome abandon(String id) {
        try {
            queue.abandon(id, workerId);
            log.info("Stop requested; handed ticket {} back", id);
        } catch (RuntimeException e) {
            log.warn("Could not hand ticket {} back on stop; lease expiry will release it", id, e);
        }
        return PollOutcome.CANCELLED;
    }
}
