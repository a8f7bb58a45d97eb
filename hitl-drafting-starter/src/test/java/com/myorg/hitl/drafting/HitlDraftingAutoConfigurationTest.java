package com.myorg.hitl.drafting;

import com.myorg.hitl.drafting.llm.LlmDraftGenerator;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.drafting.retrieval.RetrievalIndex;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class HitlDraftingAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HitlDraftingAutoConfiguration.class));

    @Test
    void withoutModels_noGeneratorOrRetrieval() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertTrue(ctx.getBeansOfType(DraftGenerator.class).isEmpty());
            assertTrue(ctx.getBeansOfType(Rephraser.class).isEmpty());
            assertTrue(ctx.getBeansOfType(RetrievalContextBuilder.class).isEmpty());
        });
    }

    @Test
    void withUserModels_wiresPipelineAndSeedsKnowledge() {
        runner.withBean(ChatModel.class, () -> mock(ChatModel.class))
                .withBean(EmbeddingModel.class, HashingEmbeddingModel::new)
                .withPropertyValues("hitl.drafting.retrieval.policy-k=2")
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertInstanceOf(LlmDraftGenerator.class, ctx.getBean(DraftGenerator.class));
                    assertNotNull(ctx.getBean(Rephraser.class));
                    assertNotNull(ctx.getBean(RetrievalContextBuilder.class));

                    RetrievalIndex policies = ctx.getBean(HitlDraftingAutoConfiguration.POLICY_INDEX, RetrievalIndex.class);
                    assertEquals(2, ctx.getBean(RetrievalContextBuilder.class)
                            .build("I was charged twice for my order").policies().size());
                    assertFalse(policies.similaritySearch("refund", 1).isEmpty());
                });
    }

    @Test
    void seedingDisabled_leavesIndexesEmpty() {
        runner.withBean(EmbeddingModel.class, HashingEmbeddingModel::new)
                .withPropertyValues("hitl.drafting.seed.enabled=false")
                .run(ctx -> {
                    RetrievalIndex policies = ctx.getBean(HitlDraftingAutoConfiguration.POLICY_INDEX, RetrievalIndex.class);
                    assertTrue(policies.similaritySearch("refund", 3).isEmpty());
                });
    }

    @Test
    void apiKeyProperty_createsOpenAiModels() {
        runner.withPropertyValues(
                        "hitl.drafting.model.api-key=test-key",
                        "hitl.drafting.embedding.api-key=test-key",
                        "hitl.drafting.seed.enabled=false")
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertNotNull(ctx.getBean(ChatModel.class));
                    assertNotNull(ctx.getBean(EmbeddingModel.class));
                    assertNotNull(ctx.getBean(DraftGenerator.class));
                });
    }
}
