package com.example.AusFin.model;

public record RetrievalRequest(
        String question,
        Integer topK,
        Double minScore,
        PassageFilter filter
) {
    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public double resolveMinScore(double defaultValue) {
        return minScore == null ? defaultValue : minScore;
    }

    public PassageFilter resolveFilter() {
        return filter == null ? PassageFilter.NONE : filter;
    }
}
