package com.myorg.hitl.drafting.retrieval;

import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.drafting.RetrievalContext;
import com.myorg.hitl.contracts.drafting.RetrievedSnippet;
import com.myorg.hitl.drafting.HitlDraftingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Gathers policy snippets and similar resolved tickets for one issue.
 */
@Slf4j
@RequiredArgsConstructor
public class RetrievalContextBuilder {

    private final RetrievalIndex policies;
    private final RetrievalIndex previousRecords;
    private final HitlDraftingProperties.Retrieval props;

    public RetrievalContext build(String issue) {
        List<RetrievedSnippet> p = search(policies, issue, props.getPolicyK());
        List<RetrievedSnippet> r = search(previousRecords, issue, props.getPreviousRecordK());
        log.debug("Retrieved {} policy and {} previous-record snippets", p.size(), r.size());
        return new RetrievalContext(p, r);
    }

    private List<RetrievedSnippet> search(RetrievalIndex index, String issue, int k) {
        try {
            return index.similaritySearch(issue, k);
        } catch (ConnectivityException e) {
            if (!props.isOptional()) throw e;
            log.warn("Index '{}' unavailable, drafting without it: {}", index.name(), e.getMessage());
            return List.of();
        }
    }
}
