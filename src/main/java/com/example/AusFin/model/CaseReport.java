package com.example.AusFin.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-case evaluation outcome.
 *
 * @param rankingEvaluated false when the case has no relevant ground truth; its ranking scores are 0
 *                         and it is left out of the ranking aggregates
 * @param error            pipeline failure recorded for this case (index outage, invalid profile)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseReport(
        String caseId,
        String query,
        String referenceAnswer,
        Intent intent,
        Confidence confidence,
        List<String> retrievedPassageIds,
        List<String> citedPassageIds,
        String answer,
        Map<String, Double> scores,
        boolean rankingEvaluated,
        String error
) {
    public CaseReport {
        retrievedPassageIds = retrievedPassageIds == null ? List.of() : List.copyOf(retrievedPassageIds);
        citedPassageIds = citedPassageIds == null ? List.of() : List.copyOf(citedPassageIds);
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public boolean unanswered() {
        return confidence == Confidence.UNANSWERABLE;
    }
}
