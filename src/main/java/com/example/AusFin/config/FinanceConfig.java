package com.example.AusFin.config;

import com.example.AusFin.model.BenchmarkCase;
import com.example.AusFin.model.RuleTable;
import com.example.AusFin.repository.BenchmarkRepository;
import com.example.AusFin.repository.RuleTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.List;

/**
 * Loads the immutable inputs once at startup. A malformed rule table or benchmark
 * fails the context, so the service never runs with partial rules.
 */
@Configuration
public class FinanceConfig {

    private static final Logger log = LoggerFactory.getLogger(FinanceConfig.class);

    @Bean
    public RuleTable ruleTable(RuleTableLoader loader, ResourceLoader resourceLoader, AdvisorProperties properties) {
        String location = properties.getRules().getLocation();
        RuleTable table = loader.load(resourceLoader.getResource(location));
        log.info("Loaded rule table {} from {} ({} tax brackets)", table.version(), location, table.taxBrackets().size());
        return table;
    }

    @Bean
    public Benchmark benchmark(BenchmarkRepository repository, ResourceLoader resourceLoader, AdvisorProperties properties) {
        String location = properties.getEvaluation().getBenchmarkLocation();
        List<BenchmarkCase> cases = repository.load(resourceLoader.getResource(location));
        log.info("Loaded {} benchmark cases from {}", cases.size(), location);
        return new Benchmark(location, cases);
    }

    /**
     * Read-only benchmark set shared by the evaluation endpoint and the startup runner.
     */
    public record Benchmark(String location, List<BenchmarkCase> cases) {
        public Benchmark {
            cases = List.copyOf(cases);
        }
    }
}
