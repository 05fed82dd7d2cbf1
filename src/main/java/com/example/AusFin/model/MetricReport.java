package com.example.AusFin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluation report: per-case rows in benchmark order plus aggregates.
 * Score metrics aggregate as the arithmetic mean over their denominator;
 * {@link #UNANSWERED_RATE} is the raw proportion of unanswerable cases.
 */
public record MetricReport(
        int benchmarkSize,
        String ruleVersion,
        List<CaseReport> cases,
        Map<String, Double> aggregate,
        Map<String, Integer> aggregateDenominators
) {
    public static final String NDCG_1 = "ndcg@1";
    public static final String NDCG_3 = "ndcg@3";
    public static final String NDCG_5 = "ndcg@5";
    public static final String MRR = "mrr";
    public static final String RECALL_5 = "recall@5";
    public static final String ROUGE_1 = "rouge1";
    public static final String ROUGE_L = "rougeL";
    public static final String SEMANTIC_SIMILARITY = "semantic_similarity";
    public static final String UNANSWERED_RATE = "unanswered_rate";

    public static final List<String> RANKING_METRICS = List.of(NDCG_1, NDCG_3, NDCG_5, MRR, RECALL_5);
    public static final List<String> ANSWER_METRICS = List.of(ROUGE_1, ROUGE_L, SEMANTIC_SIMILARITY);

    public MetricReport {
        cases = List.copyOf(cases);
        aggregate = Collections.unmodifiableMap(new LinkedHashMap<>(aggregate));
        aggregateDenominators = Collections.unmodifiableMap(new LinkedHashMap<>(aggregateDenominators));
    }

    public double aggregate(String metric) {
        return aggregate.getOrDefault(metric, 0.0);
    }
}
