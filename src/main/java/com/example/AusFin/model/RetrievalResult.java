package com.example.AusFin.model;

import java.util.List;

/**
 * Ranked retrieval output:
 * - query: the text that was embedded and searched
 * - passages: similarity-descending, ties by newer publication date, then passage id
 *
 * An empty list means "insufficient evidence", not an error.
 */
public record RetrievalResult(
        String query,
        List<ScoredPassage> passages
) {
    public RetrievalResult {
        passages = passages == null ? List.of() : List.copyOf(passages);
    }

    public static RetrievalResult empty(String query) {
        return new RetrievalResult(query, List.of());
    }

    public boolean isEmpty() {
        return passages.isEmpty();
    }

    public List<String> passageIds() {
        return passages.stream().map(ScoredPassage::id).toList();
    }

    public double topScore() {
        return passages.stream().mapToDouble(ScoredPassage::score).max().orElse(0.0);
    }
}
