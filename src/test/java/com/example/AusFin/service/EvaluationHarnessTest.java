package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.model.BenchmarkCase;
import com.example.AusFin.model.CaseReport;
import com.example.AusFin.model.Confidence;
import com.example.AusFin.model.Intent;
import com.example.AusFin.model.MetricReport;
import com.example.AusFin.model.RiskTolerance;
import com.example.AusFin.support.InMemoryVectorIndex;
import com.example.AusFin.support.KeywordEmbeddings;
import com.example.AusFin.support.TestPassages;
import com.example.AusFin.support.TestRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class EvaluationHarnessTest {

    private static final String EF_REFERENCE = "Keep six months of essential expenses, $18,000, in an emergency fund [P:asic-ef].";

    @Mock
    private EmbeddingModel embeddingModel;

    private InMemoryVectorIndex index;
    private EvaluationHarness harness;

    @BeforeEach
    void setUp() {
        lenient().when(embeddingModel.embed(anyString()))
                .thenAnswer(invocation -> KeywordEmbeddings.embed(invocation.getArgument(0)));
        index = TestPassages.knowledgeBase();
        AdvisorProperties properties = new AdvisorProperties();
        FinancialCalculator calculator = new FinancialCalculator(TestRules.au2024());
        GenerationBackend backend = (context, question) ->
                "Keep six months of essential expenses, $18,000, in an emergency fund [P:asic-ef].";

        AdvicePipeline pipeline = new AdvicePipeline(
                new QueryEnhancer(),
                new KnowledgeRetriever(embeddingModel, index, properties),
                new AnswerSynthesizer(calculator, backend, properties),
                calculator);
        harness = new EvaluationHarness(pipeline, embeddingModel, properties);
    }

    private static BenchmarkCase emergencyCase(String id, int age) {
        return new BenchmarkCase(id, "How much should I save for an emergency fund?",
                Map.of("asic-ef", 3), EF_REFERENCE,
                TestRules.profile(age, "75000", "3000", RiskTolerance.BALANCED));
    }

    private static BenchmarkCase offTopicCase() {
        return new BenchmarkCase("general-001", "What will the weather be tomorrow?",
                Map.of(), "I can't help with that.", null);
    }

    @Test
    void scoresAPerfectCase() {
        CaseReport report = harness.runCase(emergencyCase("ef-001", 35));

        assertThat(report.error()).isNull();
        assertThat(report.intent()).isEqualTo(Intent.EMERGENCY_FUND);
        assertThat(report.confidence()).isEqualTo(Confidence.ANSWERABLE);
        assertThat(report.retrievedPassageIds()).first().isEqualTo("asic-ef");
        assertThat(report.citedPassageIds()).containsExactly("asic-ef");
        assertThat(report.scores()).containsEntry(MetricReport.NDCG_1, 1.0)
                .containsEntry(MetricReport.NDCG_5, 1.0)
                .containsEntry(MetricReport.MRR, 1.0)
                .containsEntry(MetricReport.RECALL_5, 1.0);
        assertThat(report.scores().get(MetricReport.ROUGE_1)).isCloseTo(1.0, within(1e-9));
        assertThat(report.scores().get(MetricReport.SEMANTIC_SIMILARITY)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void failingCaseIsRecordedNotThrown() {
        CaseReport report = harness.runCase(emergencyCase("ef-bad", -4));

        assertThat(report.confidence()).isEqualTo(Confidence.UNANSWERABLE);
        assertThat(report.intent()).isNull();
        assertThat(report.answer()).isEmpty();
        assertThat(report.error()).startsWith("InvalidProfileException");
        assertThat(report.scores()).containsEntry(MetricReport.NDCG_5, 0.0)
                .containsEntry(MetricReport.SEMANTIC_SIMILARITY, 0.0);
    }

    @Test
    void indexOutageIsRecordedPerCase() {
        index.failWith(new DataAccessResourceFailureException("connection refused"));

        CaseReport report = harness.runCase(emergencyCase("ef-001", 35));

        assertThat(report.error()).startsWith("IndexUnavailableException").contains("connection refused");
        assertThat(report.unanswered()).isTrue();
    }

    @Test
    void aggregatesUseTheirOwnDenominators() {
        MetricReport report = harness.evaluate(List.of(
                emergencyCase("ef-001", 35),
                emergencyCase("ef-bad", -4),
                offTopicCase()));

        assertThat(report.benchmarkSize()).isEqualTo(3);
        assertThat(report.ruleVersion()).isEqualTo("AU-2024-25");
        assertThat(report.cases()).extracting(CaseReport::caseId)
                .containsExactly("ef-001", "ef-bad", "general-001");

        CaseReport offTopic = report.cases().get(2);
        assertThat(offTopic.rankingEvaluated()).isFalse();
        assertThat(offTopic.unanswered()).isTrue();

        // ranking metrics over the two cases with relevant passages
        assertThat(report.aggregateDenominators()).containsEntry(MetricReport.NDCG_1, 2)
                .containsEntry(MetricReport.ROUGE_1, 3)
                .containsEntry(MetricReport.UNANSWERED_RATE, 3);
        assertThat(report.aggregate(MetricReport.NDCG_1)).isCloseTo(0.5, within(1e-9));
        assertThat(report.aggregate(MetricReport.MRR)).isCloseTo(0.5, within(1e-9));
        assertThat(report.aggregate(MetricReport.UNANSWERED_RATE)).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void sameInputsGiveTheSameReport() {
        List<BenchmarkCase> cases = List.of(emergencyCase("ef-001", 35), offTopicCase());

        MetricReport first = harness.evaluate(cases);
        MetricReport second = harness.evaluate(cases);

        assertThat(second.aggregate()).isEqualTo(first.aggregate());
        assertThat(second.cases()).isEqualTo(first.cases());
    }

    @Test
    void emptyBenchmarkAggregatesToZero() {
        MetricReport report = harness.evaluate(List.of());

        assertThat(report.benchmarkSize()).isZero();
        assertThat(report.aggregate(MetricReport.NDCG_5)).isZero();
        assertThat(report.aggregate(MetricReport.UNANSWERED_RATE)).isZero();
    }

    @Test
    void unansweredRateIsZeroWhenEveryCaseIsAnswered() {
        MetricReport report = harness.evaluate(List.of(emergencyCase("ef-001", 35), emergencyCase("ef-002", 50)));

        assertThat(report.aggregate(MetricReport.UNANSWERED_RATE)).isEqualTo(0.0);
    }

    @Test
    void unansweredRateIsOneWhenTheIndexIsDown() {
        index.failWith(new DataAccessResourceFailureException("connection refused"));

        MetricReport report = harness.evaluate(List.of(emergencyCase("ef-001", 35), offTopicCase()));

        assertThat(report.aggregate(MetricReport.UNANSWERED_RATE)).isEqualTo(1.0);
        assertThat(report.cases()).allSatisfy(c -> assertThat(c.error()).isNotNull());
    }
}
