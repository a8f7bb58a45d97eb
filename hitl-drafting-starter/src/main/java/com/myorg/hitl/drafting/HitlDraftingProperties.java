package com.myorg.hitl.drafting;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "hitl.drafting")
public class HitlDraftingProperties {

    private Model model = new Model();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Seed seed = new Seed();

    /** Upper bound for one completion or rephrase call. */
    private Duration timeout = Duration.ofSeconds(60);

    @Data
    public static class Model {
        /** OpenAI-compatible endpoint; OpenRouter works as well. */
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String modelName = "gpt-4o-mini";
        private double temperature = 0.2;
    }

    @Data
    public static class Embedding {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String modelName = "text-embedding-3-large";
    }

    @Data
    public static class Retrieval {
        private int policyK = 3;
        private int previousRecordK = 5;
        private double minScore = 0.0;

        /** When true an unavailable index degrades to "no evidence" instead of failing the draft. */
        private boolean optional = false;
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private String policies = "classpath:hitl/knowledge/policies.json";
        private String previousRecords = "classpath:hitl/knowledge/previous-records.json";
    }
}
