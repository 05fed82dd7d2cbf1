package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.exception.InvalidProfileException;
import com.example.AusFin.model.AdviceEvent;
import com.example.AusFin.model.AdviceRequest;
import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.model.Confidence;
import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.Intent;
import com.example.AusFin.model.PassageFilter;
import com.example.AusFin.model.RetrievalOptions;
import com.example.AusFin.model.RetrievalRequest;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.ScoredPassage;
import com.example.AusFin.model.SynthesizedAnswer;
import com.example.AusFin.support.TestPassages;
import com.example.AusFin.support.TestRules;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdvisorServiceTest {

    private static final String QUESTION = "How much should I save for an emergency fund?";

    @Mock
    private AdvicePipeline pipeline;

    @Mock
    private AdviceLogService adviceLogService;

    private AdvisorService service;

    private final EnhancedQuery query = new EnhancedQuery(QUESTION, QUESTION, Intent.EMERGENCY_FUND, List.of());
    private final RetrievalResult retrieval = new RetrievalResult(QUESTION,
            List.of(new ScoredPassage(TestPassages.passage("asic-ef", "Three to six months of expenses."), 0.82)));
    private final SynthesizedAnswer answer = new SynthesizedAnswer("Hold $18000.00 [P:asic-ef].",
            List.of("asic-ef"), Confidence.ANSWERABLE, null, null);

    @BeforeEach
    void setUp() {
        service = new AdvisorService(pipeline, adviceLogService, new AdvisorProperties());
    }

    @Test
    void answerRunsThePipelineWithDefaultsAndRecordsIt() {
        AdviceRequest request = new AdviceRequest(QUESTION, "session-1", TestRules.typicalProfile(), null, null, null);
        AdviceResult result = new AdviceResult(query, retrieval, answer);
        when(pipeline.run(eq(QUESTION), eq(request.profile()), any())).thenReturn(result);
        when(pipeline.ruleVersion()).thenReturn("AU-2024-25");

        assertThat(service.answer(request)).isSameAs(result);

        ArgumentCaptor<RetrievalOptions> options = ArgumentCaptor.forClass(RetrievalOptions.class);
        verify(pipeline).run(eq(QUESTION), eq(request.profile()), options.capture());
        assertThat(options.getValue().topK()).isEqualTo(5);
        assertThat(options.getValue().minScore()).isEqualTo(0.30);
        assertThat(options.getValue().filter()).isEqualTo(PassageFilter.NONE);
        verify(adviceLogService).recordAdvice("session-1", "AU-2024-25", result);
    }

    @Test
    void anonymousRequestsGetAGeneratedSession() {
        AdviceRequest request = new AdviceRequest(QUESTION, " ", null, 3, 0.5, null);
        AdviceResult result = new AdviceResult(query, retrieval, answer);
        when(pipeline.run(eq(QUESTION), isNull(), any())).thenReturn(result);
        when(pipeline.ruleVersion()).thenReturn("AU-2024-25");

        service.answer(request);

        ArgumentCaptor<String> session = ArgumentCaptor.forClass(String.class);
        verify(adviceLogService).recordAdvice(session.capture(), eq("AU-2024-25"), eq(result));
        assertThat(session.getValue()).startsWith("anon-");
    }

    @Test
    void retrieveSkipsProfileValidationAndGeneration() {
        RetrievalRequest request = new RetrievalRequest(QUESTION, 2, 0.6, null);
        when(pipeline.enhance(QUESTION, null)).thenReturn(query);
        when(pipeline.retrieve(eq(query), any())).thenReturn(retrieval);

        assertThat(service.retrieve(request)).isSameAs(retrieval);

        ArgumentCaptor<RetrievalOptions> options = ArgumentCaptor.forClass(RetrievalOptions.class);
        verify(pipeline).retrieve(eq(query), options.capture());
        assertThat(options.getValue().topK()).isEqualTo(2);
        assertThat(options.getValue().minScore()).isEqualTo(0.6);
        verify(pipeline, never()).synthesize(any(), any(), any());
    }

    @Test
    void streamEmitsStagesInOrder() {
        AdviceRequest request = new AdviceRequest(QUESTION, "session-2", TestRules.typicalProfile(), null, null, null);
        when(pipeline.enhance(QUESTION, request.profile())).thenReturn(query);
        when(pipeline.retrieve(eq(query), any())).thenReturn(retrieval);
        when(pipeline.synthesize(query, retrieval, request.profile())).thenReturn(answer);
        when(pipeline.ruleVersion()).thenReturn("AU-2024-25");

        StepVerifier.create(service.streamAnswer(request))
                .assertNext(event -> {
                    assertThat(event.stage()).isEqualTo("start");
                    assertThat(event.payload()).asInstanceOf(InstanceOfAssertFactories.MAP).containsEntry("sessionId", "session-2");
                })
                .assertNext(event -> {
                    assertThat(event.stage()).isEqualTo("enhance");
                    assertThat(event.payload()).asInstanceOf(InstanceOfAssertFactories.MAP).containsEntry("intent", "emergency-fund");
                })
                .assertNext(event -> {
                    assertThat(event.stage()).isEqualTo("retrieve");
                    assertThat(event.payload()).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(1);
                })
                .assertNext(event -> {
                    assertThat(event.stage()).isEqualTo("answer_final");
                    assertThat(event.payload()).isSameAs(answer);
                })
                .verifyComplete();

        verify(pipeline).enhance(QUESTION, request.profile());
        verify(adviceLogService).recordAdvice(eq("session-2"), eq("AU-2024-25"), any(AdviceResult.class));
    }

    @Test
    void streamFailsAfterStartWhenTheProfileIsInvalid() {
        AdviceRequest request = new AdviceRequest(QUESTION, "session-3", TestRules.typicalProfile(), null, null, null);
        when(pipeline.enhance(anyString(), any())).thenThrow(new InvalidProfileException("age must be between 1 and 120"));

        StepVerifier.create(service.streamAnswer(request))
                .assertNext(event -> assertThat(event.stage()).isEqualTo("start"))
                .expectError(InvalidProfileException.class)
                .verify();

        verify(pipeline, never()).retrieve(any(), any());
        verify(adviceLogService, never()).recordAdvice(anyString(), anyString(), any());
    }
}
