package com.example.AusFin.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final answer returned to the caller.
 *
 * @param text            answer text with normalised {@code [P:id]} citation markers
 * @param citedPassageIds ids actually cited, in first-citation order; always a subset of the context ids
 * @param confidence      ANSWERABLE or UNANSWERABLE
 * @param calculation     calculator output embedded in the answer, if any
 * @param note            explanation for degraded answers (fallback reason, backend error)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SynthesizedAnswer(
        String text,
        List<String> citedPassageIds,
        Confidence confidence,
        CalculationResult calculation,
        String note
) {
    public SynthesizedAnswer {
        citedPassageIds = citedPassageIds == null ? List.of() : List.copyOf(citedPassageIds);
    }

    public boolean answerable() {
        return confidence == Confidence.ANSWERABLE;
    }
}
