package com.example.AusFin.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One evaluation case.
 *
 * @param id              stable case identifier used in reports
 * @param query           question replayed through the pipeline
 * @param relevance       ground-truth passage id to graded relevance (0-3)
 * @param referenceAnswer reference answer text
 * @param profile         optional profile so the case can exercise the calculator path
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BenchmarkCase(
        String id,
        String query,
        Map<String, Integer> relevance,
        String referenceAnswer,
        UserProfile profile
) {
    public BenchmarkCase {
        relevance = relevance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(relevance));
    }

    public boolean hasRelevantPassages() {
        return relevance.values().stream().anyMatch(grade -> grade != null && grade > 0);
    }
}
