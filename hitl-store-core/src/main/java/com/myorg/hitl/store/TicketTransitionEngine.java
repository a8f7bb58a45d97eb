package com.myorg.hitl.store;

import com.myorg.hitl.contracts.core.exception.InvalidTransitionException;
import com.myorg.hitl.contracts.core.exception.TicketNotFoundException;
import com.myorg.hitl.contracts.drafting.DraftResult;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Moves tickets between the lifecycle stores.
 *
 * <p>Every move removes the record from its source store and inserts the enriched record into
 * the target store inside one transaction, so the ticket is never observable in two stores and
 * is never lost between the delete and the insert. A concurrent second mover of the same ticket
 * gets {@link TicketNotFoundException}.
 */
@Slf4j
public class TicketTransitionEngine {

    private final TicketStore store;
    private final TransactionOperations tx;
    private final Clock clock;

    public TicketTransitionEngine(TicketStore store, TransactionOperations tx, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Generic move. {@code enrich} receives a copy of the source record and returns the record
     * to insert; it runs inside the transaction and may read other stores.
     *
     * @throws TicketNotFoundException    if the source store has no such ticket; the target is untouched
     * @throws InvalidTransitionException if {@code from -> to} is not a lifecycle edge
     */
    public Ticket move(String ticketId, TicketStage from, TicketStage to, UnaryOperator<Ticket> enrich) {
        requireId(ticketId);
        if (from == null || !from.canMoveTo(to)) {
            throw new InvalidTransitionException(ticketId, from, to);
        }

        Ticket moved = tx.execute(status -> {
            Ticket source = store.findAndDelete(from, ticketId)
                    .orElseThrow(() -> new TicketNotFoundException(ticketId, from));

            Ticket target = enrich.apply(source.toBuilder().build());
            target.setTicketId(ticketId);
            TicketSchema.validate(to, target);

            store.put(to, target);
            return target;
        });

        log.info("Ticket {} moved {} -> {}", ticketId, from.storeName(), to.storeName());
        return moved;
    }

    /**
     * Worker path: pending -> drafted with the generated draft attached. Only the current claim
     * owner may persist; a worker whose lease was reaped and re-claimed gets
     * {@link TicketNotFoundException} and the pending record stays as it is.
     */
    public Ticket recordDraft(String ticketId, String owner, DraftResult draft) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(draft, "draft");
        return move(ticketId, TicketStage.PENDING, TicketStage.DRAFTED, t -> {
            String current = t.getDrafting() == null ? null : t.getDrafting().claimOwner();
            if (!t.isDrafted() || !owner.equals(current)) {
                log.info("Ticket {} is no longer claimed by {} (owner={}); draft not persisted", ticketId, owner, current);
                throw new TicketNotFoundException(ticketId, TicketStage.PENDING);
            }
            return t.toBuilder()
                    .aiDraftedResponse(draft.reply())
                    .confidence(draft.confidence())
                    .usedPolicy(draft.usedPolicy())
                    .usedReferenceTicketId(draft.usedReferenceTicketId())
                    .drafting(null)
                    .metadata(meta(t).toBuilder().drafted(true).tone(draft.tone()).build())
                    .build();
        });
    }

    /**
     * Human approval: any active store -> completed, with the submitted resolution text.
     */
    public Ticket approve(String ticketId, TicketStage from, String resolution) {
        if (resolution == null || resolution.isBlank()) {
            throw new IllegalArgumentException("resolution must not be blank");
        }
        Instant now = clock.instant();
        return move(ticketId, from, TicketStage.COMPLETED, t -> complete(from, t, resolution, now));
    }

    /** Escalated -> completed. */
    public Ticket resolve(String ticketId, String resolution) {
        return approve(ticketId, TicketStage.ESCALATED, resolution);
    }

    /**
     * Pending or drafted -> escalated. The record moves verbatim; {@code reason} is recorded only
     * when the ticket carries none yet.
     */
    public Ticket escalate(String ticketId, TicketStage from, String reason) {
        return move(ticketId, from, TicketStage.ESCALATED, t -> {
            TicketMetadata m = meta(t);
            if (m.getEscalationReason() == null && reason != null && !reason.isBlank()) {
                m = m.toBuilder().escalationReason(reason).build();
            }
            return t.toBuilder().drafting(null).metadata(m).build();
        });
    }

    public Optional<Ticket> find(String ticketId) {
        requireId(ticketId);
        return store.locate(ticketId).flatMap(stage -> store.findById(stage, ticketId));
    }

    private Ticket complete(TicketStage from, Ticket t, String resolution, Instant now) {
        Ticket base = switch (from) {
            case PENDING -> fromPending(t);
            case ESCALATED -> CompletionDefaults.applyEscalatedOrigin(t);
            default -> t;
        };
        TicketMetadata m = meta(base).toBuilder()
                .closedAt(now)
                .escalationReason(null)
                .build();
        return base.toBuilder()
                .resolution(resolution)
                .drafting(null)
                .metadata(m)
                .build();
    }

    private Ticket fromPending(Ticket t) {
        if (!t.isDrafted()) {
            return t.toBuilder()
                    .aiDraftedResponse(null)
                    .confidence(null)
                    .metadata(meta(t).toBuilder().tone(null).build())
                    .build();
        }

        // drafted flag set while still pending: the draft, if any, lives in the drafted store
        Optional<Ticket> draft = store.findAndDelete(TicketStage.DRAFTED, t.getTicketId());
        if (draft.isEmpty()) {
            log.warn("Ticket {} is flagged drafted but has no drafted record; completing without draft", t.getTicketId());
            return t.toBuilder()
                    .aiDraftedResponse(null)
                    .confidence(null)
                    .metadata(meta(t).toBuilder().tone(null).build())
                    .build();
        }
        Ticket d = draft.get();
        return t.toBuilder()
                .aiDraftedResponse(d.getAiDraftedResponse())
                .confidence(d.getConfidence())
                .usedPolicy(d.getUsedPolicy())
                .usedReferenceTicketId(d.getUsedReferenceTicketId())
                .metadata(meta(t).toBuilder().tone(meta(d).getTone()).build())
                .build();
    }

    private static TicketMetadata meta(Ticket t) {
        return t.getMetadata() == null ? new TicketMetadata() : t.getMetadata();
    }

    private static void requireId(String ticketId) {
        if (ticketId == null || ticketId.isBlank()) {
            throw new IllegalArgumentException("ticketId must not be blank");
        }
    }
}
