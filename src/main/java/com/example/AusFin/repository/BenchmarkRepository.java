package com.example.AusFin.repository;

import com.example.AusFin.exception.ConfigException;
import com.example.AusFin.model.BenchmarkCase;
import com.example.AusFin.model.MetricReport;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON storage for benchmark cases and evaluation reports.
 */
@Component
public class BenchmarkRepository {

    private static final int MIN_GRADE = 0;
    private static final int MAX_GRADE = 3;

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public List<BenchmarkCase> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ConfigException("Benchmark not found: " + (resource == null ? "<none>" : resource.getDescription()));
        }
        try (InputStream in = resource.getInputStream()) {
            return read(in);
        } catch (IOException e) {
            throw new ConfigException("Malformed benchmark " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    public List<BenchmarkCase> read(InputStream in) throws IOException {
        List<BenchmarkCase> cases = mapper.readValue(in, new TypeReference<List<BenchmarkCase>>() { });
        validate(cases);
        return List.copyOf(cases);
    }

    public void write(List<BenchmarkCase> cases, OutputStream out) throws IOException {
        validate(cases);
        mapper.writeValue(out, cases);
    }

    public void writeReport(MetricReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new ConfigException("Unable to write evaluation report to " + target, e);
        }
    }

    public void validate(List<BenchmarkCase> cases) {
        if (cases == null || cases.isEmpty()) {
            throw new ConfigException("Benchmark contains no cases");
        }
        Set<String> ids = new HashSet<>();
        for (BenchmarkCase c : cases) {
            if (c == null || c.id() == null || c.id().isBlank()) {
                throw new ConfigException("Benchmark case without id");
            }
            if (!ids.add(c.id())) {
                throw new ConfigException("Duplicate benchmark case id: " + c.id());
            }
            if (c.query() == null || c.query().isBlank()) {
                throw new ConfigException("Benchmark case " + c.id() + " has no query");
            }
            if (c.referenceAnswer() == null) {
                throw new ConfigException("Benchmark case " + c.id() + " has no reference answer");
            }
            for (Map.Entry<String, Integer> grade : c.relevance().entrySet()) {
                Integer value = grade.getValue();
                if (value == null || value < MIN_GRADE || value > MAX_GRADE) {
                    throw new ConfigException("Benchmark case " + c.id() + ": grade for " + grade.getKey()
                            + " must be within [" + MIN_GRADE + "," + MAX_GRADE + "], got " + value);
                }
            }
        }
    }
}
