package com.example.AusFin.model;

import java.util.UUID;

/**
 * Request payload for a synthesized answer.
 *
 * @param question  user question
 * @param sessionId optional caller session id, only used to group audit rows
 * @param profile   optional financial profile; enables the calculator path
 * @param topK      optional override for retrieval topK
 * @param minScore  optional override for retrieval minScore
 * @param filter    optional metadata filter (document types, authorities, published-after)
 */
public record AdviceRequest(
        String question,
        String sessionId,
        UserProfile profile,
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

    public ResolvedSession resolveSession() {
        boolean anonymous = sessionId == null || sessionId.isBlank();
        String resolvedId = anonymous ? "anon-" + UUID.randomUUID() : sessionId;
        return new ResolvedSession(resolvedId, anonymous);
    }

    public record ResolvedSession(String id, boolean anonymous) { }
}
