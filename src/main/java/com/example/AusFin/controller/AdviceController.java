package com.example.AusFin.controller;

import com.example.AusFin.model.AdviceEvent;
import com.example.AusFin.model.AdviceLog;
import com.example.AusFin.model.AdviceRequest;
import com.example.AusFin.model.AdviceResult;
import com.example.AusFin.service.AdviceLogService;
import com.example.AusFin.service.AdvisorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/advice")
@RequiredArgsConstructor
public class AdviceController {

    private final AdvisorService advisorService;
    private final AdviceLogService adviceLogService;

    @PostMapping("/answer")
    public AdviceResult answer(@RequestBody AdviceRequest request) {
        return advisorService.answer(request);
    }

    @PostMapping(value = "/answer/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAnswer(@RequestBody AdviceRequest request) {
        // 0L means no timeout
        SseEmitter emitter = new SseEmitter(0L);

        // Stages: start / enhance / retrieve / answer_final
        Flux<AdviceEvent> stream = advisorService.streamAnswer(request);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // Stage as SSE event name so the client can handle each stage separately
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.stage())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    /**
     * Audit rows recorded for a session, oldest first.
     */
    @GetMapping("/history/{sessionId}")
    public List<AdviceLog> history(@PathVariable String sessionId) {
        return adviceLogService.history(sessionId);
    }
}
