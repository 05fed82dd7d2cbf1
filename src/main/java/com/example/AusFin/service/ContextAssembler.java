package com.example.AusFin.service;

import com.example.AusFin.model.CalculationResult;
import com.example.AusFin.model.ScoredPassage;
import com.example.AusFin.model.SourceMetadata;
import com.example.AusFin.util.AmountFormatter;
import com.example.AusFin.util.CitationParser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the text sent to the generation backend: labelled calculation facts first,
 * then [P:id]-tagged passages in ranking order.
 *
 * Example:
 *   Calculated figures (emergency fund, rules AU-2024-25):
 *   - Recommended emergency fund: $18000.00
 *
 *   [P:asic-ef-01] (guide | ASIC | 2024-03-01)
 *   passage text...
 */
final class ContextAssembler {

    private static final Set<String> COUNT_FIELDS = Set.of("months_covered", "years_to_retirement", "risk_score", "dependents");

    private ContextAssembler() {
    }

    /**
     * Passages are kept as a ranked prefix: once one does not fit in {@code maxChars}
     * it and everything ranked below it are dropped. Calculation facts always stay.
     */
    static ContextBlock build(CalculationResult calculation, List<ScoredPassage> passages, int maxChars) {
        StringBuilder sb = new StringBuilder();
        if (calculation != null) {
            sb.append(renderFacts(calculation));
        }
        List<String> included = new ArrayList<>();
        for (ScoredPassage passage : passages) {
            String section = renderPassage(passage);
            int separator = sb.length() == 0 ? 0 : 2;
            if (sb.length() + separator + section.length() > maxChars) {
                break;
            }
            if (separator > 0) {
                sb.append("\n\n");
            }
            sb.append(section);
            included.add(passage.id());
        }
        return new ContextBlock(sb.toString(), List.copyOf(included));
    }

    static String renderFacts(CalculationResult calculation) {
        StringBuilder sb = new StringBuilder();
        sb.append("Calculated figures (")
                .append(calculation.type().name().toLowerCase(Locale.ROOT).replace('_', ' '))
                .append(", rules ").append(calculation.ruleVersion()).append("):");
        for (Map.Entry<String, BigDecimal> field : calculation.fields().entrySet()) {
            sb.append("\n- ").append(label(field.getKey())).append(": ")
                    .append(renderValue(field.getKey(), field.getValue()));
        }
        for (String warning : calculation.warnings()) {
            sb.append("\n- Warning: ").append(warning);
        }
        return sb.toString();
    }

    /**
     * One line summary appended to completions that left out the headline figure.
     */
    static String headlineLine(CalculationResult calculation) {
        String headlineField = calculation.type().headlineField();
        return "Calculated figures: " + label(headlineField) + " "
                + renderValue(headlineField, calculation.headline()) + ".";
    }

    static String renderValue(String field, BigDecimal value) {
        if (value == null) {
            return "n/a";
        }
        if (field.endsWith("_rate")) {
            return AmountFormatter.percent(value);
        }
        if (field.endsWith("_pct")) {
            return value.toPlainString() + "%";
        }
        if (COUNT_FIELDS.contains(field)) {
            return value.toPlainString();
        }
        return AmountFormatter.currency(value);
    }

    private static String renderPassage(ScoredPassage scored) {
        SourceMetadata meta = scored.passage().metadata();
        String provenance = Stream.of(
                        meta.documentType(),
                        meta.authority(),
                        meta.publishedDate() == null ? null : meta.publishedDate().toString())
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" | "));
        String header = CitationParser.marker(scored.id())
                + (provenance.isEmpty() ? "" : " (" + provenance + ")");
        String text = scored.passage().text() == null ? "" : scored.passage().text();
        return header + "\n" + text;
    }

    private static String label(String field) {
        String words = field.replace("_pct", "").replace('_', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    /**
     * @param text       the assembled context
     * @param passageIds ids of the passages that made it into the context, in ranking order
     */
    record ContextBlock(String text, List<String> passageIds) {
    }
}
