package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.model.CalculationResult;
import com.example.AusFin.model.Confidence;
import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.EntityType;
import com.example.AusFin.model.GenerationAttempt;
import com.example.AusFin.model.Intent;
import com.example.AusFin.model.QueryEntity;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.ScoredPassage;
import com.example.AusFin.model.SynthesizedAnswer;
import com.example.AusFin.model.UserProfile;
import com.example.AusFin.util.AmountFormatter;
import com.example.AusFin.util.CitationParser;
import com.example.AusFin.util.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns retrieved passages and calculator output into a cited answer.
 *
 * Flow:
 *  1. run the calculation the intent calls for (needs a profile)
 *  2. short-circuit to "unanswerable" when there is neither evidence nor a calculation
 *  3. call the generation backend; on failure retry once with half the passages
 *  4. keep only citations to passages that were actually in the context,
 *     normalise currency and make sure the headline figure is stated
 */
@Service
public class AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String NO_EVIDENCE_ANSWER =
            "I don't have enough reliable information to answer that. "
                    + "Try rephrasing the question or adding your age, income and expenses for a calculated answer.";

    static final String BACKEND_FAILURE_ANSWER =
            "I couldn't generate an answer right now. Please try again shortly.";

    private static final int SACRIFICE_WINDOW_BEFORE = 30;
    private static final int SACRIFICE_WINDOW_AFTER = 20;
    private static final Pattern SACRIFICE_BEFORE = Pattern.compile("\\b(sacrific|contribut|put|add)\\w*\\s+(an extra\\s+|another\\s+)?$");
    private static final Pattern SACRIFICE_AFTER = Pattern.compile("^\\s*(a year\\s+|per year\\s+|p\\.a\\.\\s+)?(in)?to\\s+(my\\s+)?super");

    private final FinancialCalculator calculator;
    private final GenerationBackend generationBackend;
    private final int maxContextChars;
    private final double minEvidenceScore;
    private final Duration backendTimeout;

    public AnswerSynthesizer(FinancialCalculator calculator,
                             GenerationBackend generationBackend,
                             AdvisorProperties properties) {
        this.calculator = calculator;
        this.generationBackend = generationBackend;
        this.maxContextChars = properties.getSynthesis().getMaxContextChars();
        this.minEvidenceScore = properties.getSynthesis().getMinEvidenceScore();
        this.backendTimeout = properties.getSynthesis().getBackendTimeout();
    }

    public SynthesizedAnswer synthesize(EnhancedQuery query, Intent intent, RetrievalResult retrieval, UserProfile profile) {
        CalculationResult calculation = calculate(intent, query, profile).orElse(null);

        if (calculation == null && retrieval.isEmpty()) {
            log.debug("No passages and no calculation for intent={}; answering unanswerable", intent);
            return unanswerable(NO_EVIDENCE_ANSWER, null, "No passage cleared the relevance cutoff.");
        }
        if (calculation == null && retrieval.topScore() < minEvidenceScore) {
            log.debug("Best passage score {} below evidence threshold {}", retrieval.topScore(), minEvidenceScore);
            return unanswerable(NO_EVIDENCE_ANSWER, null, String.format(Locale.US,
                    "Best passage score %.3f is below the evidence threshold %.3f.",
                    retrieval.topScore(), minEvidenceScore));
        }

        ContextAssembler.ContextBlock context =
                ContextAssembler.build(calculation, retrieval.passages(), maxContextChars);
        if (calculation == null && context.passageIds().isEmpty()) {
            log.debug("No passage fits in {} context chars; answering unanswerable", maxContextChars);
            return unanswerable(NO_EVIDENCE_ANSWER, null,
                    "No retrieved passage fits within the context budget of " + maxContextChars + " characters.");
        }
        GenerationAttempt attempt = attempt(context, query.original(), false);

        if (attempt.outcome() == GenerationAttempt.Outcome.RETRY) {
            List<ScoredPassage> shortened = firstHalf(retrieval.passages(), context.passageIds().size());
            log.warn("Generation failed ({}); retrying with {} of {} passages",
                    attempt.error(), shortened.size(), context.passageIds().size());
            context = ContextAssembler.build(calculation, shortened, maxContextChars);
            if (calculation == null && context.passageIds().isEmpty()) {
                return unanswerable(NO_EVIDENCE_ANSWER, null, "Generation failed and no passage is left to retry with.");
            }
            attempt = attempt(context, query.original(), true);
        }

        if (!attempt.succeeded()) {
            log.warn("Generation failed after retry: {}", attempt.error());
            return unanswerable(BACKEND_FAILURE_ANSWER, calculation,
                    "Generation backend failed after retry: " + attempt.error());
        }
        return postProcess(attempt.rawText(), context, calculation);
    }

    /**
     * Which calculation answers the intent. Intents without a calculation, or a missing
     * profile, give none; an invalid profile fails with InvalidProfileException.
     */
    Optional<CalculationResult> calculate(Intent intent, EnhancedQuery query, UserProfile profile) {
        if (profile == null) {
            return Optional.empty();
        }
        return switch (intent) {
            case EMERGENCY_FUND -> Optional.of(calculator.emergencyFund(profile));
            case SUPER -> Optional.of(calculator.superOptimisation(profile, sacrificeAmount(query, profile)));
            case ALLOCATION -> Optional.of(calculator.allocationStrategy(profile));
            case METALS, STOCKS, GENERAL -> Optional.empty();
        };
    }

    /**
     * The amount the user wants to sacrifice: one written right after "sacrifice"/"contribute"
     * or right before "into super", else the first amount below their income. Null falls back
     * to the calculator's default.
     */
    static BigDecimal sacrificeAmount(EnhancedQuery query, UserProfile profile) {
        String question = query.original() == null ? "" : query.original().toLowerCase(Locale.ROOT);
        List<QueryEntity> amounts = query.entities().stream()
                .filter(e -> e.type() == EntityType.AMOUNT && e.value() != null)
                .toList();

        int from = 0;
        for (QueryEntity amount : amounts) {
            int at = question.indexOf(amount.text().toLowerCase(Locale.ROOT), from);
            if (at < 0) {
                continue;
            }
            int end = at + amount.text().length();
            String before = question.substring(Math.max(0, at - SACRIFICE_WINDOW_BEFORE), at);
            String after = question.substring(end, Math.min(question.length(), end + SACRIFICE_WINDOW_AFTER));
            if (SACRIFICE_BEFORE.matcher(before).find() || SACRIFICE_AFTER.matcher(after).find()) {
                return amount.value();
            }
            from = end;
        }
        return amounts.stream()
                .map(QueryEntity::value)
                .filter(value -> profile.annualIncome() == null || value.compareTo(profile.annualIncome()) < 0)
                .findFirst()
                .orElse(null);
    }

    private GenerationAttempt attempt(ContextAssembler.ContextBlock context, String question, boolean retried) {
        try {
            String raw = Timeouts.callWithin(backendTimeout,
                    () -> generationBackend.complete(context.text(), question));
            if (raw == null || raw.isBlank()) {
                return GenerationAttempt.failure("empty completion", retried);
            }
            return GenerationAttempt.success(raw);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.debug("Generation attempt failed (retried={})", retried, cause);
            return GenerationAttempt.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage(), retried);
        }
    }

    private SynthesizedAnswer postProcess(String raw, ContextAssembler.ContextBlock context, CalculationResult calculation) {
        CitationParser.ParsedCompletion parsed = CitationParser.parse(raw, context.passageIds());
        String text = AmountFormatter.normaliseCurrency(parsed.text());

        if (calculation != null && !AmountFormatter.mentions(text, calculation.headline())) {
            text = (text.isBlank() ? "" : text + "\n\n") + ContextAssembler.headlineLine(calculation);
        }

        String note = null;
        if (!parsed.rejected().isEmpty()) {
            log.warn("Removed {} citation markers not present in the context: {}", parsed.rejected().size(), parsed.rejected());
            note = "Removed citations to passages that were not provided: " + String.join(", ", parsed.rejected());
        }
        return new SynthesizedAnswer(text, parsed.citedIds(), Confidence.ANSWERABLE, calculation, note);
    }

    /**
     * Half of the passages that were in the failed context; a single passage is retried as is.
     */
    private static List<ScoredPassage> firstHalf(List<ScoredPassage> passages, int included) {
        int keep = included > 1 ? included / 2 : included;
        return passages.subList(0, Math.min(keep, passages.size()));
    }

    private static SynthesizedAnswer unanswerable(String text, CalculationResult calculation, String note) {
        String answer = calculation == null ? text : text + "\n\n" + ContextAssembler.headlineLine(calculation);
        return new SynthesizedAnswer(answer, List.of(), Confidence.UNANSWERABLE, calculation, note);
    }
}
