package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.model.BenchmarkCase;
import com.example.AusFin.model.CaseReport;
import com.example.AusFin.model.Confidence;
import com.example.AusFin.model.MetricReport;
import com.example.AusFin.model.RetrievalOptions;
import com.example.AusFin.util.RankingMetrics;
import com.example.AusFin.util.RougeScorer;
import com.example.AusFin.util.Timeouts;
import com.example.AusFin.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays benchmark cases through the advice pipeline and scores them.
 *
 * Cases run concurrently (bounded by {@code advisor.evaluation.parallelism}) but the
 * report lists them in benchmark order, so identical inputs give an identical report.
 * A failing case is recorded as unanswerable with its error; it never aborts the run.
 */
@Service
public class EvaluationHarness {

    private static final Logger log = LoggerFactory.getLogger(EvaluationHarness.class);

    private final AdvicePipeline pipeline;
    private final EmbeddingModel embeddingModel;
    private final int parallelism;
    private final RetrievalOptions options;
    private final Duration embeddingTimeout;

    public EvaluationHarness(AdvicePipeline pipeline, EmbeddingModel embeddingModel, AdvisorProperties properties) {
        this.pipeline = pipeline;
        this.embeddingModel = embeddingModel;
        AdvisorProperties.Evaluation evaluation = properties.getEvaluation();
        this.parallelism = Math.max(1, evaluation.getParallelism());
        this.options = new RetrievalOptions(evaluation.getTopK(), evaluation.getMinScore(), null);
        this.embeddingTimeout = properties.getRetrieval().getTimeout();
    }

    public MetricReport evaluate(List<BenchmarkCase> cases) {
        log.info("Evaluating {} benchmark cases (parallelism={})", cases.size(), parallelism);
        List<CaseReport> reports = Flux.fromIterable(cases)
                .flatMapSequential(c -> Mono.fromCallable(() -> runCase(c))
                        .subscribeOn(Schedulers.boundedElastic()), parallelism)
                .collectList()
                .block();

        MetricReport report = aggregate(reports == null ? List.of() : reports);
        log.info("Evaluation finished: {}", report.aggregate());
        return report;
    }

    CaseReport runCase(BenchmarkCase benchmarkCase) {
        try {
            AdviceResult result = pipeline.run(benchmarkCase.query(), benchmarkCase.profile(), options);
            List<String> ranked = result.retrieval().passageIds();
            String answer = result.answer().text();
            return new CaseReport(
                    benchmarkCase.id(),
                    benchmarkCase.query(),
                    benchmarkCase.referenceAnswer(),
                    result.query().intent(),
                    result.answer().confidence(),
                    ranked,
                    result.answer().citedPassageIds(),
                    answer,
                    score(benchmarkCase, ranked, answer),
                    benchmarkCase.hasRelevantPassages(),
                    null
            );
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.warn("Benchmark case {} failed: {}", benchmarkCase.id(), cause.toString());
            return new CaseReport(
                    benchmarkCase.id(),
                    benchmarkCase.query(),
                    benchmarkCase.referenceAnswer(),
                    null,
                    Confidence.UNANSWERABLE,
                    List.of(),
                    List.of(),
                    "",
                    score(benchmarkCase, List.of(), ""),
                    benchmarkCase.hasRelevantPassages(),
                    cause.getClass().getSimpleName() + ": " + cause.getMessage()
            );
        }
    }

    private Map<String, Double> score(BenchmarkCase benchmarkCase, List<String> ranked, String answer) {
        Map<String, Integer> grades = benchmarkCase.relevance();
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(MetricReport.NDCG_1, RankingMetrics.ndcgAtK(ranked, grades, 1));
        scores.put(MetricReport.NDCG_3, RankingMetrics.ndcgAtK(ranked, grades, 3));
        scores.put(MetricReport.NDCG_5, RankingMetrics.ndcgAtK(ranked, grades, 5));
        scores.put(MetricReport.MRR, RankingMetrics.reciprocalRank(ranked, grades));
        scores.put(MetricReport.RECALL_5, RankingMetrics.recallAtK(ranked, grades, 5));
        scores.put(MetricReport.ROUGE_1, RougeScorer.rouge1(answer, benchmarkCase.referenceAnswer()));
        scores.put(MetricReport.ROUGE_L, RougeScorer.rougeL(answer, benchmarkCase.referenceAnswer()));
        scores.put(MetricReport.SEMANTIC_SIMILARITY, semanticSimilarity(benchmarkCase.id(), answer, benchmarkCase.referenceAnswer()));
        return scores;
    }

    /**
     * Cosine similarity of answer and reference embeddings; 0 when either text is empty
     * or the embedding backend fails for this case.
     */
    private double semanticSimilarity(String caseId, String answer, String reference) {
        if (answer == null || answer.isBlank() || reference == null || reference.isBlank()) {
            return 0.0;
        }
        try {
            float[] answerEmbedding = Timeouts.callWithin(embeddingTimeout, () -> embeddingModel.embed(answer));
            float[] referenceEmbedding = Timeouts.callWithin(embeddingTimeout, () -> embeddingModel.embed(reference));
            if (answerEmbedding == null || referenceEmbedding == null) {
                return 0.0;
            }
            return VectorMath.cosineSimilarity(answerEmbedding, referenceEmbedding);
        } catch (RuntimeException e) {
            log.warn("Semantic similarity unavailable for case {}: {}", caseId, Exceptions.unwrap(e).toString());
            return 0.0;
        }
    }

    /**
     * Ranking metrics average over cases with relevant ground truth only;
     * answer metrics and the unanswered rate average over every case.
     */
    MetricReport aggregate(List<CaseReport> reports) {
        Map<String, Double> aggregate = new LinkedHashMap<>();
        Map<String, Integer> denominators = new LinkedHashMap<>();

        List<CaseReport> ranked = reports.stream().filter(CaseReport::rankingEvaluated).toList();
        for (String metric : MetricReport.RANKING_METRICS) {
            aggregate.put(metric, mean(ranked, metric));
            denominators.put(metric, ranked.size());
        }
        for (String metric : MetricReport.ANSWER_METRICS) {
            aggregate.put(metric, mean(reports, metric));
            denominators.put(metric, reports.size());
        }
        long unanswered = reports.stream().filter(CaseReport::unanswered).count();
        aggregate.put(MetricReport.UNANSWERED_RATE, reports.isEmpty() ? 0.0 : (double) unanswered / reports.size());
        denominators.put(MetricReport.UNANSWERED_RATE, reports.size());

        return new MetricReport(reports.size(), pipeline.ruleVersion(), reports, aggregate, denominators);
    }

    private static double mean(List<CaseReport> reports, String metric) {
        if (reports.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (CaseReport report : reports) {
            sum += report.scores().getOrDefault(metric, 0.0);
        }
        return sum / reports.size();
    }
}
