package com.replymail.domain;

/**
 * Per-message retrieval decision. Not persisted.
 */
public record EvaluationDecision(
        boolean needsRetrieval,
        String query,
        double confidence,
        String rationale,
        Source source) {

    public enum Source {
        HEURISTIC,
        MODEL,
        FALLBACK
    }

    public static EvaluationDecision direct(String rationale, double confidence, Source source) {
        return new EvaluationDecision(false, "", confidence, rationale, source);
    }

    public static EvaluationDecision retrieve(String query, String rationale, double confidence, Source source) {
        return new EvaluationDecision(true, query, confidence, rationale, source);
    }
}
