package com.myorg.hitl.contracts.drafting;

import java.util.List;

public record DraftRequest(
        String ticketId,
        String issue,
        List<RetrievedSnippet> policyContext,
        List<RetrievedSnippet> previousRecordContext
) {
    public DraftRequest {
        if (ticketId == null || ticketId.isBlank()) throw new IllegalArgumentException("ticketId must not be blank");
        if (issue == null) throw new IllegalArgumentException("issue must not be null");
        policyContext = policyContext == null ? List.of() : List.copyOf(policyContext);
        previousRecordContext = previousRecordContext == null ? List.of() : List.copyOf(previousRecordContext);
    }

    public static DraftRequest of(String ticketId, String issue, RetrievalContext ctx) {
        RetrievalContext c = ctx == null ? RetrievalContext.empty() : ctx;
        return new DraftRequest(ticketId, issue, c.policies(), c.previousRecords());
    }
}
