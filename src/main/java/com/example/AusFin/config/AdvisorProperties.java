package com.example.AusFin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the advisory pipeline, bound from {@code advisor.*}.
 */
@Data
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    private Retrieval retrieval = new Retrieval();
    private Synthesis synthesis = new Synthesis();
    private Generation generation = new Generation();
    private Rules rules = new Rules();
    private Evaluation evaluation = new Evaluation();

    @Data
    public static class Retrieval {
        private int defaultTopK = 5;
        private double defaultMinScore = 0.30;
        /** Index candidates requested per wanted passage, so metadata filtering still leaves topK. */
        private int candidateMultiplier = 3;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Synthesis {
        private int maxContextChars = 6000;
        /** Without a calculation, answers need at least one passage scoring this high. */
        private double minEvidenceScore = 0.45;
        private Duration backendTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Generation {
        /** ChatClient key: "deepseek" or "openai". */
        private String model = "deepseek";
        private String systemPrompt = """
                You are an Australian personal-finance assistant. Answer only from the supplied context.
                Cite every passage you rely on with its marker exactly as given, e.g. [P:ato-super-caps].
                Quote calculated figures verbatim. If the context does not answer the question, say so.
                This is general information, not personal financial advice.""";
    }

    @Data
    public static class Rules {
        private String location = "classpath:rules/au-2024-25.yaml";
    }

    @Data
    public static class Evaluation {
        private String benchmarkLocation = "classpath:benchmark/au-finance-benchmark.json";
        private int parallelism = 4;
        private int topK = 5;
        private double minScore = 0.30;
        /** Where the JSON report is written; empty means "do not write". */
        private String reportPath = "";
        /** Run the benchmark once at startup and write the report (offline mode). */
        private boolean runOnStartup = false;
    }
}
