package com.myorg.hitl.store;

import com.myorg.hitl.contracts.core.exception.DuplicateTicketException;
import com.myorg.hitl.contracts.ticket.NewTicket;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Raises new tickets directly into any lifecycle store, filling the manual-entry defaults
 * for the chosen store.
 */
@Slf4j
public class TicketIntake {

    static final String MANUAL_POLICY = "Manual";
    static final String NO_REFERENCE = "N/A";
    static final String DEFAULT_TONE = "Professional";
    static final double DEFAULT_MANUAL_CONFIDENCE = 0.8;
    static final String MANUAL_ESCALATION = "Manual Escalation";
    static final String ESCALATION_POLICY = "Escalation Protocol";
    static final String MANUAL_RESOLUTION = "Manual Resolution";

    private final TicketStore store;
    private final Clock clock;

    public TicketIntake(TicketStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Ticket raise(NewTicket req, TicketStage target) {
        if (req == null) throw new IllegalArgumentException("request must not be null");
        if (target == null) throw new IllegalArgumentException("target stage must not be null");
        if (isBlank(req.getTicketId()) || isBlank(req.getIssue())) {
            throw new IllegalArgumentException("Ticket ID and Issue are required.");
        }
        String id = req.getTicketId().trim();

        // fast path for a friendly error; the store enforces uniqueness atomically on create
        if (store.locate(id).isPresent()) {
            throw new DuplicateTicketException(id);
        }

        Instant now = clock.instant();
        TicketMetadata.TicketMetadataBuilder meta = TicketMetadata.builder()
                .category(req.getCategory())
                .priority(req.getPriority())
                .createdAt(now)
                .drafted(target == TicketStage.DRAFTED);

        Ticket.TicketBuilder t = Ticket.builder().ticketId(id).issue(req.getIssue());

        switch (target) {
            case PENDING -> { }
            case DRAFTED -> {
                meta.tone(isBlank(req.getTone()) ? DEFAULT_TONE : req.getTone());
                t.aiDraftedResponse(req.getAiDraftedResponse() == null ? "" : req.getAiDraftedResponse())
                        .confidence(req.getConfidence() == null ? DEFAULT_MANUAL_CONFIDENCE : req.getConfidence())
                        .usedPolicy(MANUAL_POLICY)
                        .usedReferenceTicketId(NO_REFERENCE);
            }
            case ESCALATED -> {
                meta.escalationReason(isBlank(req.getEscalationReason()) ? null : req.getEscalationReason());
                t.aiDraftedResponse(MANUAL_ESCALATION)
                        .confidence(1.0)
                        .usedPolicy(ESCALATION_POLICY)
                        .usedReferenceTicketId(NO_REFERENCE);
            }
            case COMPLETED -> {
                meta.closedAt(now);
                t.resolution(req.getResolution() == null ? "" : req.getResolution())
                        .aiDraftedResponse(MANUAL_RESOLUTION)
                        .confidence(1.0)
                        .usedPolicy(NO_REFERENCE)
                        .usedReferenceTicketId(NO_REFERENCE);
            }
        }

        Ticket ticket = t.metadata(meta.build()).build();
        TicketSchema.validate(target, ticket);
        store.create(target, ticket);

        log.info("Ticket {} raised in {}", id, target.storeName());
        return ticket;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
