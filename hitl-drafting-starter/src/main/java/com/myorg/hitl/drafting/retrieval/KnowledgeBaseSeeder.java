package com.myorg.hitl.drafting.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.hitl.drafting.HitlDraftingProperties;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Loads policy snippets and previously resolved tickets from JSON into the in-memory embedding
 * stores at startup. Externally managed stores are left alone.
 *
 * <p>File format: {@code [{"text": "...", "metadata": {"policy": "Refund Policy"}}, ...]}
 */
@Slf4j
@RequiredArgsConstructor
public class KnowledgeBaseSeeder implements InitializingBean {

    public record Entry(String text, Map<String, Object> metadata) {}

    private final ResourceLoader resourceLoader;
    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> policyStore;
    private final EmbeddingStore<TextSegment> previousRecordStore;
    private final HitlDraftingProperties.Seed props;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void afterPropertiesSet() {
        seed("policy", props.getPolicies(), policyStore);
        seed("previous-record", props.getPreviousRecords(), previousRecordStore);
    }

    int seed(String name, String location, EmbeddingStore<TextSegment> store) {
        if (!(store instanceof InMemoryEmbeddingStore)) {
            log.info("Index '{}' is externally managed; not seeding", name);
            return 0;
        }
        Resource res = resourceLoader.getResource(location);
        if (!res.exists()) {
            log.warn("Seed file {} for index '{}' not found", location, name);
            return 0;
        }

        List<Entry> entries;
        try (InputStream in = res.getInputStream()) {
            entries = mapper.readValue(in, new TypeReference<List<Entry>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read seed file " + location, e);
        }

        List<TextSegment> segments = entries.stream()
                .filter(e -> e.text() != null && !e.text().isBlank())
                .map(e -> TextSegment.from(e.text(), e.metadata() == null ? new Metadata() : Metadata.from(e.metadata())))
                .toList();
        if (segments.isEmpty()) return 0;

        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        store.addAll(embeddings, segments);
        log.info("Seeded index '{}' with {} entries from {}", name, segments.size(), location);
        return segments.size();
    }
}
