package com.example.AusFin.model;

/**
 * A single pipeline stage event streamed to the client.
 *
 * stage   - "start", "enhance", "retrieve", "answer_final"
 * message - human-readable description of the stage
 * payload - stage data: intent and entities, retrieval summary, or the final answer
 */
public record AdviceEvent(
        String stage,
        String message,
        Object payload
) {
}
