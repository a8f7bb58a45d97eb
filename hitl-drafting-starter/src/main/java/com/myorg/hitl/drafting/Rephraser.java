package com.myorg.hitl.drafting;

/**
 * Rewrites agent text to be more polite and professional without changing its meaning.
 */
public interface Rephraser {

    String rephrase(String text, double temperature);
}
