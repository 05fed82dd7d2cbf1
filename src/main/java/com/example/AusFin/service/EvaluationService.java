package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.config.FinanceConfig;
import com.example.AusFin.model.MetricReport;
import com.example.AusFin.repository.BenchmarkRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs the configured benchmark and, when a report path is set, writes the JSON report.
 */
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final EvaluationHarness harness;
    private final FinanceConfig.Benchmark benchmark;
    private final BenchmarkRepository benchmarkRepository;
    private final AdvisorProperties properties;

    public MetricReport runBenchmark() {
        MetricReport report = harness.evaluate(benchmark.cases());
        String reportPath = properties.getEvaluation().getReportPath();
        if (reportPath != null && !reportPath.isBlank()) {
            benchmarkRepository.writeReport(report, Path.of(reportPath));
            log.info("Evaluation report written to {}", reportPath);
        }
        return report;
    }
}
