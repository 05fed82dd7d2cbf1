package com.example.AusFin.service;

import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.RetrievalOptions;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.SynthesizedAnswer;
import com.example.AusFin.model.UserProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * enhance -> retrieve -> synthesize. Shared by the HTTP surface and the evaluation harness,
 * so both exercise exactly the same path.
 */
@Service
@RequiredArgsConstructor
public class AdvicePipeline {

    private final QueryEnhancer queryEnhancer;
    private final KnowledgeRetriever knowledgeRetriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final FinancialCalculator financialCalculator;

    public AdviceResult run(String question, UserProfile profile, RetrievalOptions options) {
        EnhancedQuery query = enhance(question, profile);
        RetrievalResult retrieval = retrieve(query, options);
        SynthesizedAnswer answer = synthesize(query, retrieval, profile);
        return new AdviceResult(query, retrieval, answer);
    }

    /**
     * Validates a supplied profile before any external call is made.
     */
    public EnhancedQuery enhance(String question, UserProfile profile) {
        if (profile != null) {
            financialCalculator.validate(profile);
        }
        return queryEnhancer.enhance(question);
    }

    public RetrievalResult retrieve(EnhancedQuery query, RetrievalOptions options) {
        return knowledgeRetriever.retrieve(query.text(), options);
    }

    public SynthesizedAnswer synthesize(EnhancedQuery query, RetrievalResult retrieval, UserProfile profile) {
        return answerSynthesizer.synthesize(query, query.intent(), retrieval, profile);
    }

    public String ruleVersion() {
        return financialCalculator.ruleVersion();
    }
}
