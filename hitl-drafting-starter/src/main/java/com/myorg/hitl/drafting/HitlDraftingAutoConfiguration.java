package com.myorg.hitl.drafting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.hitl.drafting.llm.DraftResponseParser;
import com.myorg.hitl.drafting.llm.LlmDraftGenerator;
import com.myorg.hitl.drafting.llm.LlmRephraser;
import com.myorg.hitl.drafting.retrieval.EmbeddingStoreRetrievalIndex;
import com.myorg.hitl.drafting.retrieval.KnowledgeBaseSeeder;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.drafting.retrieval.RetrievalIndex;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;

@AutoConfiguration
@EnableConfigurationProperties(HitlDraftingProperties.class)
@ConditionalOnClass(ChatModel.class)
public class HitlDraftingAutoConfiguration {

    public static final String POLICY_STORE = "policyEmbeddingStore";
    public static final String PREVIOUS_RECORD_STORE = "previousRecordEmbeddingStore";
    public static final String POLICY_INDEX = "policyIndex";
    public static final String PREVIOUS_RECORD_INDEX = "previousRecordIndex";

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "hitl.drafting.model", name = "api-key")
    public ChatModel hitlChatModel(HitlDraftingProperties props) {
        HitlDraftingProperties.Model m = props.getModel();
        return OpenAiChatModel.builder()
                .baseUrl(m.getBaseUrl())
                .apiKey(m.getApiKey())
                .modelName(m.getModelName())
                .temperature(m.getTemperature())
                .timeout(props.getTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "hitl.drafting.embedding", name = "api-key")
    public EmbeddingModel hitlEmbeddingModel(HitlDraftingProperties props) {
        HitlDraftingProperties.Embedding e = props.getEmbedding();
        return OpenAiEmbeddingModel.builder()
                .baseUrl(e.getBaseUrl())
                .apiKey(e.getApiKey())
                .modelName(e.getModelName())
                .timeout(props.getTimeout())
                .build();
    }

    @Bean(name = POLICY_STORE)
    @ConditionalOnMissingBean(name = POLICY_STORE)
    public EmbeddingStore<TextSegment> policyEmbeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }

    @Bean(name = PREVIOUS_RECORD_STORE)
    @ConditionalOnMissingBean(name = PREVIOUS_RECORD_STORE)
    public EmbeddingStore<TextSegment> previousRecordEmbeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }

    @Bean(name = POLICY_INDEX)
    @ConditionalOnMissingBean(name = POLICY_INDEX)
    @ConditionalOnBean(EmbeddingModel.class)
    public RetrievalIndex policyIndex(EmbeddingModel embeddingModel,
                                      @Qualifier(POLICY_STORE) EmbeddingStore<TextSegment> store,
                                      HitlDraftingProperties props) {
        return new EmbeddingStoreRetrievalIndex("policy", embeddingModel, store, props.getRetrieval().getMinScore());
    }

    @Bean(name = PREVIOUS_RECORD_INDEX)
    @ConditionalOnMissingBean(name = PREVIOUS_RECORD_INDEX)
    @ConditionalOnBean(EmbeddingModel.class)
    public RetrievalIndex previousRecordIndex(EmbeddingModel embeddingModel,
                                              @Qualifier(PREVIOUS_RECORD_STORE) EmbeddingStore<TextSegment> store,
                                              HitlDraftingProperties props) {
        return new EmbeddingStoreRetrievalIndex("previous-record", embeddingModel, store, props.getRetrieval().getMinScore());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(name = { POLICY_INDEX, PREVIOUS_RECORD_INDEX })
    public RetrievalContextBuilder retrievalContextBuilder(@Qualifier(POLICY_INDEX) RetrievalIndex policies,
                                                           @Qualifier(PREVIOUS_RECORD_INDEX) RetrievalIndex previousRecords,
                                                           HitlDraftingProperties props) {
        return new RetrievalContextBuilder(policies, previousRecords, props.getRetrieval());
    }

    @Bean
    @ConditionalOnMissingBean
    public DraftResponseParser draftResponseParser() {
        return new DraftResponseParser(new ObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean(DraftGenerator.class)
    @ConditionalOnBean(ChatModel.class)
    public DraftGenerator llmDraftGenerator(ChatModel chatModel, DraftResponseParser parser, HitlDraftingProperties props) {
        return new LlmDraftGenerator(chatModel, parser, props.getModel().getTemperature());
    }

    @Bean
    @ConditionalOnMissingBean(Rephraser.class)
    @ConditionalOnBean(ChatModel.class)
    public Rephraser llmRephraser(ChatModel chatModel) {
        return new LlmRephraser(chatModel);
    }

    @Bean
    @ConditionalOnBean(EmbeddingModel.class)
    @ConditionalOnProperty(prefix = "hitl.drafting.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KnowledgeBaseSeeder knowledgeBaseSeeder(ResourceLoader resourceLoader,
                                                   EmbeddingModel embeddingModel,
                                                   @Qualifier(POLICY_STORE) EmbeddingStore<TextSegment> policyStore,
                                                   @Qualifier(PREVIOUS_RECORD_STORE) EmbeddingStore<TextSegment> previousRecordStore,
                                                   HitlDraftingProperties props) {
        return new KnowledgeBaseSeeder(resourceLoader, embeddingModel, policyStore, previousRecordStore, props.getSeed());
    }
}
