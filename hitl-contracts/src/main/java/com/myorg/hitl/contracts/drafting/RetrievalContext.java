package com.myorg.hitl.contracts.drafting;

import java.util.List;

public record RetrievalContext(List<RetrievedSnippet> policies, List<RetrievedSnippet> previousRecords) {

    public RetrievalContext {
        policies = policies == null ? List.of() : List.copyOf(policies);
        previousRecords = previousRecords == null ? List.of() : List.copyOf(previousRecords);
    }

    public static RetrievalContext empty() {
        return new RetrievalContext(List.of(), List.of());
    }

    public boolean isEmpty() {
        return policies.isEmpty() && previousRecords.isEmpty();
    }
}
