package com.myorg.hitl.review.web;

/** Request bodies of the review API. */
public final class ReviewRequests {

    private ReviewRequests() {
    }

    /** {@code from}: the store the reviewer saw the ticket in (pending, drafted or escalated). */
    public record Approve(String from, String resolution) {}

    public record Escalate(String from, String reason) {}

    public record Resolve(String resolution) {}

    public record Rephrase(String text, Double temperature) {}

    public record Rephrased(String text) {}
}
