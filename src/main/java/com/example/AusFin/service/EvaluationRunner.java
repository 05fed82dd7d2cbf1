package com.example.AusFin.service;

import com.example.AusFin.model.MetricReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline mode: {@code advisor.evaluation.run-on-startup=true} runs the benchmark once
 * after startup and writes the report to {@code advisor.evaluation.report-path}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "advisor.evaluation", name = "run-on-startup", havingValue = "true")
public class EvaluationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EvaluationRunner.class);

    private final EvaluationService evaluationService;

    @Override
    public void run(ApplicationArguments args) {
        MetricReport report = evaluationService.runBenchmark();
        log.info("Offline evaluation of {} cases: {}", report.benchmarkSize(), report.aggregate());
    }
}
