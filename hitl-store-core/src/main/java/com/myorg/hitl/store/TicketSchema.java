package com.myorg.hitl.store;

import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;

/**
 * Stage-specific shape checks, applied on every write to a store.
 */
public final class TicketSchema {

    private TicketSchema() {
    }

    public static void validate(TicketStage stage, Ticket t) {
        if (stage == null) throw new IllegalArgumentException("stage must not be null");
        if (t == null) throw new IllegalArgumentException("ticket must not be null");
        if (isBlank(t.getTicketId())) throw new IllegalArgumentException("ticketId must not be blank");
        if (t.getIssue() == null) throw new IllegalArgumentException("issue must not be null");

        TicketMetadata m = t.getMetadata();
        if (m == null) throw invalid(stage, t, "metadata is missing");
        if (m.getCreatedAt() == null) throw invalid(stage, t, "creation time is missing");

        Double c = t.getConfidence();
        if (c != null && !isUnitInterval(c)) throw invalid(stage, t, "confidence " + c + " outside [0,1]");

        if (stage != TicketStage.PENDING && t.getDrafting() != null) {
            throw invalid(stage, t, "claim state is only kept in the pending store");
        }
        if (stage != TicketStage.ESCALATED && m.getEscalationReason() != null) {
            throw invalid(stage, t, "escalation reason is only kept in the escalated store");
        }
        if (stage != TicketStage.COMPLETED) {
            if (t.getResolution() != null) throw invalid(stage, t, "resolution before completion");
            if (m.getClosedAt() != null) throw invalid(stage, t, "closure time before completion");
        }

        switch (stage) {
            case DRAFTED -> {
                if (!m.isDrafted()) throw invalid(stage, t, "drafted flag not set");
                if (t.getAiDraftedResponse() == null) throw invalid(stage, t, "draft text is missing");
                if (c == null) throw invalid(stage, t, "confidence is missing");
            }
            case COMPLETED -> {
                if (t.getResolution() == null) throw invalid(stage, t, "resolution is missing");
                if (m.getClosedAt() == null) throw invalid(stage, t, "closure time is missing");
            }
            default -> {
            }
        }
    }

    public static boolean isUnitInterval(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }

    private static IllegalArgumentException invalid(TicketStage stage, Ticket t, String why) {
        return new IllegalArgumentException("Invalid " + stage.storeName() + " ticket " + t.getTicketId() + ": " + why);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
