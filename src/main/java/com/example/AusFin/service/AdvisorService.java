package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.model.AdviceEvent;
import com.example.AusFin.model.AdviceRequest;
import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.RetrievalOptions;
import com.example.AusFin.model.RetrievalRequest;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.SynthesizedAnswer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AdvisorService {

    private final AdvicePipeline pipeline;
    private final AdviceLogService adviceLogService;
    private final AdvisorProperties properties;

    /**
     * Non-streaming answer: run the pipeline once and record the audit row.
     */
    public AdviceResult answer(AdviceRequest request) {
        AdviceRequest.ResolvedSession session = request.resolveSession();
        AdviceResult result = pipeline.run(request.question(), request.profile(), toOptions(request));
        adviceLogService.recordAdvice(session.id(), pipeline.ruleVersion(), result);
        return result;
    }

    /**
     * Retrieval-only: enhanced query plus ranked passages, no generation.
     */
    public RetrievalResult retrieve(RetrievalRequest request) {
        AdvisorProperties.Retrieval defaults = properties.getRetrieval();
        RetrievalOptions options = new RetrievalOptions(
                request.resolveTopK(defaults.getDefaultTopK()),
                request.resolveMinScore(defaults.getDefaultMinScore()),
                request.resolveFilter()
        );
        EnhancedQuery query = pipeline.enhance(request.question(), null);
        return pipeline.retrieve(query, options);
    }

    /**
     * Staged answer stream.
     *
     * Stages:
     *  - "start": request accepted
     *  - "enhance": intent and entities detected
     *  - "retrieve": knowledge base searched
     *  - "answer_final": synthesized answer
     */
    public Flux<AdviceEvent> streamAnswer(AdviceRequest request) {
        AdviceRequest.ResolvedSession session = request.resolveSession();
        RetrievalOptions options = toOptions(request);

        Mono<EnhancedQuery> enhanceMono =
                Mono.fromCallable(() -> pipeline.enhance(request.question(), request.profile()))
                        .cache();

        // Embedding + index lookups block, keep them off the request thread
        Mono<RetrievalResult> retrievalMono = enhanceMono
                .flatMap(query -> Mono.fromCallable(() -> pipeline.retrieve(query, options))
                        .subscribeOn(Schedulers.boundedElastic()))
                .cache();

        Mono<SynthesizedAnswer> answerMono = Mono.zip(enhanceMono, retrievalMono)
                .flatMap(tuple -> Mono.fromCallable(() -> {
                            SynthesizedAnswer answer = pipeline.synthesize(tuple.getT1(), tuple.getT2(), request.profile());
                            adviceLogService.recordAdvice(session.id(), pipeline.ruleVersion(),
                                    new AdviceResult(tuple.getT1(), tuple.getT2(), answer));
                            return answer;
                        })
                        .subscribeOn(Schedulers.boundedElastic()));

        Flux<AdviceEvent> startStep = Flux.just(new AdviceEvent(
                "start",
                "Request received.",
                Map.of("ts", System.currentTimeMillis(), "sessionId", session.id())
        ));

        Flux<AdviceEvent> enhanceStep = enhanceMono.map(query -> new AdviceEvent(
                "enhance",
                "Detected intent and entities.",
                summarizeQuery(query)
        )).flux();

        Flux<AdviceEvent> retrieveStep = retrievalMono.map(retrieval -> new AdviceEvent(
                "retrieve",
                "Searched knowledge base for related passages.",
                summarizeRetrieval(retrieval)
        )).flux();

        Flux<AdviceEvent> finalStep = answerMono.map(answer -> new AdviceEvent(
                "answer_final",
                "Finalized answer.",
                answer
        )).flux();

        return Flux.concat(startStep, enhanceStep, retrieveStep, finalStep);
    }

    private RetrievalOptions toOptions(AdviceRequest request) {
        AdvisorProperties.Retrieval defaults = properties.getRetrieval();
        return new RetrievalOptions(
                request.resolveTopK(defaults.getDefaultTopK()),
                request.resolveMinScore(defaults.getDefaultMinScore()),
                request.resolveFilter()
        );
    }

    private Map<String, Object> summarizeQuery(EnhancedQuery query) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("intent", query.intent().tag());
        summary.put("text", query.text());
        summary.put("entities", query.entities());
        return summary;
    }

    /**
     * Basic metadata and a short preview of each passage.
     */
    private List<Map<String, Object>> summarizeRetrieval(RetrievalResult retrieval) {
        return retrieval.passages().stream()
                .map(sp -> {
                    String content = sp.passage().text();
                    String preview;
                    if (content == null) {
                        preview = "";
                    } else if (content.length() > 200) {
                        preview = content.substring(0, 200) + "...";
                    } else {
                        preview = content;
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", sp.id());
                    row.put("type", sp.passage().metadata().documentType());
                    row.put("score", sp.score());
                    row.put("preview", preview);
                    return row;
                })
                .toList();
    }
}
