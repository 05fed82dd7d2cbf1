package com.example.AusFin.model;

/**
 * Outcome of one generation backend call.
 * SUCCESS carries the raw completion; RETRY means try once more with a shorter context;
 * FALLBACK means give up and answer "unanswerable".
 */
public record GenerationAttempt(Outcome outcome, String rawText, String error) {

    public enum Outcome {
        SUCCESS,
        RETRY,
        FALLBACK
    }

    public static GenerationAttempt success(String rawText) {
        return new GenerationAttempt(Outcome.SUCCESS, rawText, null);
    }

    /**
     * A failed first attempt asks for a retry, a failed retry falls back.
     */
    public static GenerationAttempt failure(String error, boolean alreadyRetried) {
        return new GenerationAttempt(alreadyRetried ? Outcome.FALLBACK : Outcome.RETRY, null, error);
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }
}
