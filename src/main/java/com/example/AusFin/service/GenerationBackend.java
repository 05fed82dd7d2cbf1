package com.example.AusFin.service;

/**
 * Text generation over a prepared context. The returned text is untrusted: it may cite
 * passages that were never supplied, or be malformed. Any runtime exception means failure.
 */
public interface GenerationBackend {

    String complete(String promptContext, String query);
}
