package com.example.AusFin.controller;

import com.example.AusFin.model.RetrievalRequest;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.service.AdvisorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/advice")
@RequiredArgsConstructor
public class RetrievalController {

    private final AdvisorService advisorService;

    /**
     * Simple mode, defaults for topK / minScore:
     *   GET /api/advice/retrieve?q=how+much+can+I+salary+sacrifice
     */
    @GetMapping("/retrieve")
    public RetrievalResult retrieveByQueryParam(@RequestParam("q") String question) {
        return advisorService.retrieve(new RetrievalRequest(question, null, null, null));
    }

    /**
     * Advanced mode:
     *   POST /api/advice/retrieve
     *   {
     *     "question": "gold ETF fees",
     *     "topK": 8,
     *     "minScore": 0.4,
     *     "filter": { "authorities": ["ASIC"], "publishedAfter": "2023-07-01" }
     *   }
     */
    @PostMapping("/retrieve")
    public RetrievalResult retrieveByBody(@RequestBody RetrievalRequest request) {
        return advisorService.retrieve(request);
    }
}
