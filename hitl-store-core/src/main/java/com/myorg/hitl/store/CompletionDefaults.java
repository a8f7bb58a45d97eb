package com.myorg.hitl.store;

import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;

/**
 * Defaults for optional fields when an escalated ticket is completed without AI evidence.
 */
public final class CompletionDefaults {

    public static final String MANUAL_HANDLING = "Senior agent handled the response";

    private CompletionDefaults() {
    }

    /**
     * Missing text fields get {@link #MANUAL_HANDLING}. A missing confidence stays absent and
     * the ticket is flagged {@code manuallyHandled} instead.
     */
    public static Ticket applyEscalatedOrigin(Ticket t) {
        boolean manual = t.getAiDraftedResponse() == null || t.getConfidence() == null;
        TicketMetadata m = t.getMetadata().toBuilder()
                .manuallyHandled(t.getMetadata().isManuallyHandled() || manual)
                .build();
        return t.toBuilder()
                .aiDraftedResponse(orDefault(t.getAiDraftedResponse()))
                .usedPolicy(orDefault(t.getUsedPolicy()))
                .usedReferenceTicketId(orDefault(t.getUsedReferenceTicketId()))
                .metadata(m)
                .build();
    }

    private static String orDefault(String v) {
        return v == null ? MANUAL_HANDLING : v;
    }
}
