package com.myorg.hitl.review;

/** How much a reviewer should trust a draft at a glance. */
public enum ConfidenceBand {
    HIGH,
    MEDIUM,
    /** Manual review recommended. */
    LOW;

    public static ConfidenceBand of(Double confidence) {
        if (confidence == null) return null;
        if (confidence > 0.9) return HIGH;
        if (confidence > 0.7) return MEDIUM;
        return LOW;
    }
}
