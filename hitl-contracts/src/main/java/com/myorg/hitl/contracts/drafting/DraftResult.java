package com.myorg.hitl.contracts.drafting;

/**
 * Validated output of the draft generator. {@code usedPolicy} and
 * {@code usedReferenceTicketId} are null when no evidence was used.
 */
public record DraftResult(
        String ticketId,
        String reply,
        String tone,
        double confidence,
        String usedPolicy,
        String usedReferenceTicketId
) {}
