package com.myorg.hitl.drafting.retrieval;

import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.drafting.RetrievedSnippet;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.RequiredArgsConstructor;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * {@link RetrievalIndex} over a langchain4j {@link EmbeddingStore}. Stores report a relevance
 * score in [0,1] (higher is closer); it is turned into a distance as {@code max(0, 1 - score)}.
 */
@RequiredArgsConstructor
public class EmbeddingStoreRetrievalIndex implements RetrievalIndex {

    private final String name;
    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> store;
    private final double minScore;

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<RetrievedSnippet> similaritySearch(String query, int k) {
        if (k <= 0 || query == null || query.isBlank()) return List.of();

        EmbeddingSearchResult<TextSegment> res;
        try {
            Embedding q = embeddingModel.embed(query).content();
            res = store.search(EmbeddingSearchRequest.builder()
                    .queryEmbedding(q)
                    .maxResults(k)
                    .minScore(minScore)
                    .build());
        } catch (RuntimeException e) {
            throw new ConnectivityException("retrieval index '" + name + "' unavailable: " + e.getMessage(), e);
        }

        if (res == null || res.matches() == null) return List.of();
        return res.matches().stream()
                .filter(m -> m.embedded() != null)
                .map(EmbeddingStoreRetrievalIndex::toSnippet)
                .sorted(Comparator.comparingDouble(RetrievedSnippet::distance))
                .limit(k)
                .toList();
    }

    private static RetrievedSnippet toSnippet(EmbeddingMatch<TextSegment> m) {
        double score = m.score() == null ? 0.0 : m.score();
        Map<String, Object> meta = m.embedded().metadata() == null ? Map.of() : m.embedded().metadata().toMap();
        return new RetrievedSnippet(m.embedded().text(), meta, Math.max(0.0, 1.0 - score));
    }
}
