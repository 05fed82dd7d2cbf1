package com.example.AusFin.controller;

import com.example.AusFin.model.BenchmarkCase;
import com.example.AusFin.model.MetricReport;
import com.example.AusFin.service.EvaluationHarness;
import com.example.AusFin.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/evaluation")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final EvaluationHarness evaluationHarness;

    /**
     * Runs the configured benchmark; blocks until every case has been scored.
     */
    @PostMapping("/run")
    public MetricReport runBenchmark() {
        return evaluationService.runBenchmark();
    }

    /**
     * Scores caller-supplied cases instead of the configured benchmark.
     */
    @PostMapping("/cases")
    public MetricReport runCases(@RequestBody List<BenchmarkCase> cases) {
        if (cases == null || cases.isEmpty()) {
            throw new IllegalArgumentException("at least one benchmark case is required");
        }
        return evaluationHarness.evaluate(cases);
    }
}
