package com.example.AusFin.service;

import com.example.AusFin.model.AdviceLog;
import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.model.CalculationResult;
import com.example.AusFin.repository.AdviceLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit trail of answered questions. A failing audit write never fails the answer.
 */
@Service
@RequiredArgsConstructor
public class AdviceLogService {

    private static final Logger log = LoggerFactory.getLogger(AdviceLogService.class);

    private final AdviceLogRepository adviceLogRepository;
    private final ObjectMapper objectMapper;

    public void recordAdvice(String sessionId, String ruleVersion, AdviceResult result) {
        AdviceLog adviceLog = new AdviceLog();
        adviceLog.setSessionId(sessionId);
        adviceLog.setRuleVersion(ruleVersion);
        adviceLog.setIntent(result.query().intent());
        adviceLog.setQuestion(result.query().original());
        adviceLog.setEnhancedQuery(result.query().text());
        adviceLog.setAnswer(result.answer().text());
        adviceLog.setConfidence(result.answer().confidence());
        adviceLog.setCitationsJson(serializeCitations(result.answer().citedPassageIds()));
        adviceLog.setCalculationJson(serializeCalculation(result.answer().calculation()));
        adviceLog.setNote(truncate(result.answer().note()));

        try {
            adviceLogRepository.save(adviceLog);
        } catch (DataAccessException e) {
            log.warn("Failed to persist advice log for session {}", sessionId, e);
        }
    }

    public List<AdviceLog> history(String sessionId) {
        return adviceLogRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    private String serializeCitations(List<String> citations) {
        if (citations == null || citations.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(citations);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize citations for advice log", e);
            return "[]";
        }
    }

    private String serializeCalculation(CalculationResult calculation) {
        if (calculation == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(calculation);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize calculation for advice log", e);
            return null;
        }
    }

    private static String truncate(String note) {
        return note == null || note.length() <= 1024 ? note : note.substring(0, 1024);
    }
}
