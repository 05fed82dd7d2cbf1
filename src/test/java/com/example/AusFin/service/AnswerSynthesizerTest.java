package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.exception.BackendFailureException;
import com.example.AusFin.model.CalculationType;
import com.example.AusFin.model.Confidence;
import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.EntityType;
import com.example.AusFin.model.Intent;
import com.example.AusFin.model.QueryEntity;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.RiskTolerance;
import com.example.AusFin.model.ScoredPassage;
import com.example.AusFin.model.SynthesizedAnswer;
import com.example.AusFin.support.TestPassages;
import com.example.AusFin.support.TestRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerSynthesizerTest {

    @Mock
    private GenerationBackend backend;

    private AnswerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new AnswerSynthesizer(new FinancialCalculator(TestRules.au2024()), backend, new AdvisorProperties());
    }

    private static EnhancedQuery query(String question, Intent intent, QueryEntity... entities) {
        return new EnhancedQuery(question, question, intent, List.of(entities));
    }

    private static ScoredPassage scored(String id, String text, double score) {
        return new ScoredPassage(TestPassages.passage(id, text), score);
    }

    private static RetrievalResult retrieval(String text, ScoredPassage... passages) {
        return new RetrievalResult(text, List.of(passages));
    }

    @Test
    void noEvidenceAndNoCalculationSkipsTheBackend() {
        EnhancedQuery q = query("What will the weather be?", Intent.GENERAL);

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.GENERAL, RetrievalResult.empty(q.text()), null);

        assertThat(answer.confidence()).isEqualTo(Confidence.UNANSWERABLE);
        assertThat(answer.text()).isEqualTo(AnswerSynthesizer.NO_EVIDENCE_ANSWER);
        assertThat(answer.citedPassageIds()).isEmpty();
        verifyNoInteractions(backend);
    }

    @Test
    void weakEvidenceWithoutCalculationSkipsTheBackend() {
        EnhancedQuery q = query("Is gold a good hedge?", Intent.METALS);

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.METALS,
                retrieval(q.text(), scored("mint-gold", "Gold bullion and inflation.", 0.40)), null);

        assertThat(answer.answerable()).isFalse();
        assertThat(answer.note()).contains("evidence threshold");
        verifyNoInteractions(backend);
    }

    @Test
    void calculationAloneIsEnoughToAnswer() {
        EnhancedQuery q = query("How big should my emergency fund be?", Intent.EMERGENCY_FUND);
        when(backend.complete(anyString(), eq(q.original()))).thenReturn("Aim for $18,000 in an accessible account.");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.EMERGENCY_FUND,
                RetrievalResult.empty(q.text()), TestRules.typicalProfile());

        assertThat(answer.answerable()).isTrue();
        assertThat(answer.text()).isEqualTo("Aim for $18000.00 in an accessible account.");
        assertThat(answer.calculation().type()).isEqualTo(CalculationType.EMERGENCY_FUND);
        assertThat(answer.citedPassageIds()).isEmpty();
    }

    @Test
    void contextCarriesFactsBeforePassages() {
        EnhancedQuery q = query("How big should my emergency fund be?", Intent.EMERGENCY_FUND);
        when(backend.complete(anyString(), anyString())).thenReturn("Six months [P:asic-ef].");

        synthesizer.synthesize(q, Intent.EMERGENCY_FUND,
                retrieval(q.text(), scored("asic-ef", "Three to six months of expenses.", 0.9)),
                TestRules.typicalProfile());

        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(backend).complete(context.capture(), eq(q.original()));

        String sent = context.getValue();
        assertThat(sent).startsWith("Calculated figures (emergency fund, rules AU-2024-25):");
        assertThat(sent).contains("- Recommended emergency fund: $18000.00");
        assertThat(sent).contains("- Months covered: 6");
        assertThat(sent.indexOf("[P:asic-ef]")).isGreaterThan(sent.indexOf("$18000.00"));
    }

    @Test
    void headlineFigureIsAppendedWhenTheCompletionOmitsIt() {
        EnhancedQuery q = query("How big should my emergency fund be?", Intent.EMERGENCY_FUND);
        when(backend.complete(anyString(), anyString())).thenReturn("Keep several months of expenses aside [P:asic-ef].");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.EMERGENCY_FUND,
                retrieval(q.text(), scored("asic-ef", "Three to six months of expenses.", 0.9)),
                TestRules.typicalProfile());

        assertThat(answer.text()).endsWith("Calculated figures: Recommended emergency fund $18000.00.");
        assertThat(answer.citedPassageIds()).containsExactly("asic-ef");
    }

    @Test
    void citationsOutsideTheContextAreRemoved() {
        EnhancedQuery q = query("Is gold a good hedge?", Intent.METALS);
        when(backend.complete(anyString(), anyString()))
                .thenReturn("Gold held value [P:mint-gold] and always rises [P:gold-blog].");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.METALS,
                retrieval(q.text(), scored("mint-gold", "Gold bullion and inflation.", 0.8)), null);

        assertThat(answer.answerable()).isTrue();
        assertThat(answer.citedPassageIds()).containsExactly("mint-gold");
        assertThat(answer.text()).doesNotContain("gold-blog");
        assertThat(answer.note()).contains("gold-blog");
    }

    @Test
    void citedIdsNeverIncludePassagesThatDidNotFitTheContext() {
        AdvisorProperties properties = new AdvisorProperties();
        properties.getSynthesis().setMaxContextChars(80);
        AnswerSynthesizer tight = new AnswerSynthesizer(new FinancialCalculator(TestRules.au2024()), backend, properties);
        EnhancedQuery q = query("Is gold a good hedge?", Intent.METALS);
        when(backend.complete(anyString(), anyString())).thenReturn("See [P:first] and [P:second].");

        SynthesizedAnswer answer = tight.synthesize(q, Intent.METALS, retrieval(q.text(),
                scored("first", "Gold bullion and inflation.", 0.9),
                scored("second", "A much longer passage about gold that will not fit in the remaining budget.", 0.8)),
                null);

        assertThat(answer.citedPassageIds()).containsExactly("first");
    }

    @Test
    void retriesOnceWithHalfThePassages() {
        EnhancedQuery q = query("Is gold a good hedge?", Intent.METALS);
        when(backend.complete(anyString(), anyString()))
                .thenThrow(new BackendFailureException("rate limited"))
                .thenReturn("Gold held value [P:p1].");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.METALS, retrieval(q.text(),
                scored("p1", "Gold one.", 0.9),
                scored("p2", "Gold two.", 0.8),
                scored("p3", "Gold three.", 0.7),
                scored("p4", "Gold four.", 0.6)), null);

        assertThat(answer.answerable()).isTrue();
        assertThat(answer.citedPassageIds()).containsExactly("p1");
        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(backend, times(2)).complete(context.capture(), anyString());
        List<String> contexts = context.getAllValues();
        assertThat(contexts).hasSize(2);
        assertThat(contexts.get(0)).contains("[P:p4]");
        assertThat(contexts.get(1)).contains("[P:p1]", "[P:p2]").doesNotContain("[P:p3]", "[P:p4]");
    }

    @Test
    void blankCompletionCountsAsFailure() {
        EnhancedQuery q = query("Is gold a good hedge?", Intent.METALS);
        when(backend.complete(anyString(), anyString())).thenReturn("   ").thenReturn("Gold held value [P:p1].");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.METALS,
                retrieval(q.text(), scored("p1", "Gold one.", 0.9)), null);

        assertThat(answer.answerable()).isTrue();
        verify(backend, times(2)).complete(anyString(), anyString());
    }

    @Test
    void secondFailureFallsBackToUnanswerableWithTheCalculatedFigure() {
        EnhancedQuery q = query("How big should my emergency fund be?", Intent.EMERGENCY_FUND);
        when(backend.complete(anyString(), anyString())).thenThrow(new BackendFailureException("down"));

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.EMERGENCY_FUND,
                retrieval(q.text(), scored("asic-ef", "Three to six months of expenses.", 0.9)),
                TestRules.typicalProfile());

        assertThat(answer.confidence()).isEqualTo(Confidence.UNANSWERABLE);
        assertThat(answer.text()).startsWith(AnswerSynthesizer.BACKEND_FAILURE_ANSWER).contains("$18000.00");
        assertThat(answer.citedPassageIds()).isEmpty();
        assertThat(answer.note()).contains("down");
        verify(backend, times(2)).complete(anyString(), anyString());
    }

    @Test
    void validCitationsAreKeptIntactWithoutANote() {
        EnhancedQuery q = query("What is the concessional cap?", Intent.GENERAL);
        when(backend.complete(anyString(), anyString())).thenReturn("The cap is $30,000 [P:ato-cap].");

        SynthesizedAnswer answer = synthesizer.synthesize(q, Intent.GENERAL,
                retrieval(q.text(), scored("ato-cap", "The concessional contributions cap is $30,000.", 0.9)), null);

        assertThat(answer.text()).isEqualTo("The cap is $30000.00 [P:ato-cap].");
        assertThat(answer.citedPassageIds()).containsExactly("ato-cap");
        assertThat(answer.note()).isNull();
    }

    @Test
    void noPassageFittingTheContextBudgetSkipsTheBackend() {
        AdvisorProperties properties = new AdvisorProperties();
        properties.getSynthesis().setMaxContextChars(50);
        AnswerSynthesizer tight = new AnswerSynthesizer(new FinancialCalculator(TestRules.au2024()), backend, properties);
        EnhancedQuery q = query("Is gold a good buy?", Intent.METALS);

        SynthesizedAnswer answer = tight.synthesize(q, Intent.METALS, retrieval(q.text(),
                scored("mint-gold", "Gold bullion has held its value through several inflationary periods in Australia.", 0.9)),
                null);

        assertThat(answer.confidence()).isEqualTo(Confidence.UNANSWERABLE);
        assertThat(answer.text()).isEqualTo(AnswerSynthesizer.NO_EVIDENCE_ANSWER);
        assertThat(answer.citedPassageIds()).isEmpty();
        verifyNoInteractions(backend);
    }

    @Test
    void superIntentPrefersTheAmountNextToSacrificeOverTheIncome() {
        EnhancedQuery q = query("I earn $90,000 a year. Should I salary sacrifice $5,000 into super?", Intent.SUPER,
                new QueryEntity(EntityType.AMOUNT, "$90,000", new BigDecimal("90000")),
                new QueryEntity(EntityType.AMOUNT, "$5,000", new BigDecimal("5000")));

        assertThat(synthesizer.calculate(Intent.SUPER, q, TestRules.profile(40, "90000", "4000", RiskTolerance.BALANCED)))
                .hasValueSatisfying(calc -> {
                    assertThat(calc.field("desired_sacrifice")).isEqualByComparingTo("5000");
                    assertThat(calc.field("excess_sacrifice")).isEqualByComparingTo("0");
                    assertThat(calc.warnings()).isEmpty();
                });
    }

    @Test
    void superIntentIgnoresAnIncomeSizedAmountAndUsesTheDefault() {
        EnhancedQuery q = query("I earn $75,000. What should I do with my super?", Intent.SUPER,
                new QueryEntity(EntityType.AMOUNT, "$75,000", new BigDecimal("75000")));

        // 10% of 75,000 is below the cap headroom of 30,000 - 8,625
        assertThat(synthesizer.calculate(Intent.SUPER, q, TestRules.typicalProfile()))
                .hasValueSatisfying(calc -> assertThat(calc.field("desired_sacrifice")).isEqualByComparingTo("7500"));
    }

    @Test
    void superIntentTakesTheAmountNextToSacrifice() {
        EnhancedQuery q = query("Should I salary sacrifice $5,000 into super?", Intent.SUPER,
                new QueryEntity(EntityType.AMOUNT, "$5,000", new BigDecimal("5000")));

        assertThat(synthesizer.calculate(Intent.SUPER, q, TestRules.typicalProfile()))
                .hasValueSatisfying(calc -> {
                    assertThat(calc.type()).isEqualTo(CalculationType.SUPER_OPTIMISATION);
                    assertThat(calc.field("desired_sacrifice")).isEqualByComparingTo("5000");
                });
    }

    @Test
    void intentsWithoutACalculator() {
        EnhancedQuery q = query("Is VAS a good ETF?", Intent.STOCKS);

        assertThat(synthesizer.calculate(Intent.STOCKS, q, TestRules.typicalProfile())).isEmpty();
        assertThat(synthesizer.calculate(Intent.METALS, q, TestRules.typicalProfile())).isEmpty();
        assertThat(synthesizer.calculate(Intent.GENERAL, q, TestRules.typicalProfile())).isEmpty();
        assertThat(synthesizer.calculate(Intent.ALLOCATION, q, null)).isEmpty();
    }
}
