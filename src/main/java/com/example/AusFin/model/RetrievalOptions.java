package com.example.AusFin.model;

/**
 * Resolved retrieval parameters for one pipeline run.
 */
public record RetrievalOptions(int topK, double minScore, PassageFilter filter) {

    public RetrievalOptions {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        if (minScore < 0.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be within [0,1]");
        }
        filter = filter == null ? PassageFilter.NONE : filter;
    }
}
