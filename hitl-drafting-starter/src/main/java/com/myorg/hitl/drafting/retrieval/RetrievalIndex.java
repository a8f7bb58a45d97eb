package com.myorg.hitl.drafting.retrieval;

import com.myorg.hitl.contracts.drafting.RetrievedSnippet;

import java.util.List;

/**
 * Read-only similarity search over one knowledge collection.
 */
public interface RetrievalIndex {

    String name();

    /**
     * @return at most {@code k} snippets, closest first
     * @throws com.myorg.hitl.contracts.core.exception.ConnectivityException if the index is unreachable
     */
    List<RetrievedSnippet> similaritySearch(String query, int k);
}
