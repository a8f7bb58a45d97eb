package com.myorg.hitl.contracts.drafting;

import java.util.Map;

/**
 * One similarity hit. Lower distance means closer.
 */
public record RetrievedSnippet(String content, Map<String, Object> metadata, double distance) {

    public RetrievedSnippet {
        if (distance < 0) {
            throw new IllegalArgumentException("distance must be non-negative");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public double confidence() {
        return 1.0 / (1.0 + distance);
    }
}
