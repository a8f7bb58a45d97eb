package com.myorg.hitl.review;

import com.myorg.hitl.contracts.core.exception.TicketNotFoundException;
import com.myorg.hitl.contracts.core.exception.TicketStoreException;
import com.myorg.hitl.contracts.drafting.RetrievalContext;
import com.myorg.hitl.contracts.ticket.NewTicket;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.drafting.Rephraser;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.store.ClaimQueue;
import com.myorg.hitl.store.TicketIntake;
import com.myorg.hitl.store.TicketStore;
import com.myorg.hitl.store.TicketTransitionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Action handlers behind the review screens. Failed actions leave every store unchanged.
 */
@Slf4j
@Service
public class ReviewService {

    public static final int DEFAULT_LIMIT = 10;

    private final TicketStore store;
    private final ClaimQueue queue;
    private final TicketTransitionEngine transitions;
    private final TicketIntake intake;
    private final ObjectProvider<Rephraser> rephraser;
    private final ObjectProvider<RetrievalContextBuilder> retrieval;

    public ReviewService(TicketStore store,
                         ClaimQueue queue,
                         TicketTransitionEngine transitions,
                         TicketIntake intake,
                         ObjectProvider<Rephraser> rephraser,
                         ObjectProvider<RetrievalContextBuilder> retrieval) {
        this.store = store;
        this.queue = queue;
        this.transitions = transitions;
        this.intake = intake;
        this.rephraser = rephraser;
        this.retrieval = retrieval;
    }

    /** Newest first. A store outage shows as an empty list rather than an error page. */
    public List<TicketView> list(TicketStage stage, int limit) {
        try {
            return store.listRecent(stage, limit <= 0 ? DEFAULT_LIMIT : limit).stream()
                    .map(t -> TicketView.of(stage, t))
                    .toList();
        } catch (TicketStoreException e) {
            log.error("Failed to load {} tickets: {}", stage.storeName(), e.getMessage());
            return List.of();
        }
    }

    public TicketView get(String ticketId) {
        TicketStage stage = store.locate(ticketId).orElseThrow(() -> new TicketNotFoundException(ticketId, null));
        Ticket t = store.findById(stage, ticketId).orElseThrow(() -> new TicketNotFoundException(ticketId, stage));
        return TicketView.of(stage, t);
    }

    /** Policy snippets and similar resolved tickets for the ticket's issue. */
    public Optional<RetrievalContext> evidence(String ticketId) {
        TicketView v = get(ticketId);
        RetrievalContextBuilder builder = retrieval.getIfAvailable();
        if (builder == null) return Optional.empty();
        return Optional.of(builder.build(v.ticket().getIssue()));
    }

    public TicketView approve(String ticketId, TicketStage from, String resolution) {
        return TicketView.of(TicketStage.COMPLETED, transitions.approve(ticketId, from, resolution));
    }

    public TicketView escalate(String ticketId, TicketStage from, String reason) {
        return TicketView.of(TicketStage.ESCALATED, transitions.escalate(ticketId, from, reason));
    }

    public TicketView resolve(String ticketId, String resolution) {
        return TicketView.of(TicketStage.COMPLETED, transitions.resolve(ticketId, resolution));
    }

    public TicketView raise(NewTicket req, TicketStage target) {
        return TicketView.of(target, intake.raise(req, target));
    }

    /** @return empty when no completion model is configured */
    public Optional<String> rephrase(String text, double temperature) {
        Rephraser r = rephraser.getIfAvailable();
        if (r == null) return Optional.empty();
        return Optional.of(r.rephrase(text, temperature));
    }

    public List<TicketView> needsAttention(int limit) {
        return queue.listNeedsAttention(limit <= 0 ? DEFAULT_LIMIT : limit).stream()
                .map(t -> TicketView.of(TicketStage.PENDING, t))
                .toList();
    }

    /** @return false if the ticket is not parked for attention */
    public boolean retryDraft(String ticketId) {
        boolean ok = queue.retryDraft(ticketId);
        if (ok) log.info("Ticket {} returned to the drafting queue", ticketId);
        return ok;
    }
}
