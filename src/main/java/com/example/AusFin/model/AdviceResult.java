package com.example.AusFin.model;

/**
 * Everything one pipeline run produced: the enhanced query, the ranked evidence and the answer.
 */
public record AdviceResult(
        EnhancedQuery query,
        RetrievalResult retrieval,
        SynthesizedAnswer answer
) {
}
