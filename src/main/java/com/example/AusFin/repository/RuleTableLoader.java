package com.example.AusFin.repository;

import com.example.AusFin.exception.ConfigException;
import com.example.AusFin.model.RuleTable;
import com.example.AusFin.model.TaxBracket;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Reads a versioned rule table from YAML ({@code .yaml}/{@code .yml}) or JSON.
 * Unknown keys are rejected so a typo cannot silently fall back to a default.
 */
@Component
public class RuleTableLoader {

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public RuleTable load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ConfigException("Rule table not found: " + describe(resource));
        }
        RuleTable table;
        try (InputStream in = resource.getInputStream()) {
            table = mapperFor(resource).readValue(in, RuleTable.class);
        } catch (IOException e) {
            throw new ConfigException("Malformed rule table " + describe(resource) + ": " + e.getMessage(), e);
        }
        validate(table);
        return table;
    }

    public RuleTable parse(String content, boolean yaml) {
        RuleTable table;
        try {
            table = (yaml ? yamlMapper : jsonMapper).readValue(content, RuleTable.class);
        } catch (IOException e) {
            throw new ConfigException("Malformed rule table: " + e.getMessage(), e);
        }
        validate(table);
        return table;
    }

    public void validate(RuleTable table) {
        if (table == null) {
            throw new ConfigException("Rule table is empty");
        }
        if (table.version() == null || table.version().isBlank()) {
            throw new ConfigException("Rule table has no version");
        }
        List<TaxBracket> brackets = table.taxBrackets();
        if (brackets.isEmpty()) {
            throw new ConfigException("Rule table " + table.version() + " has no tax brackets");
        }
        BigDecimal previous = null;
        for (TaxBracket bracket : brackets) {
            if (bracket == null || bracket.lowerBound() == null || bracket.rate() == null) {
                throw new ConfigException("Rule table " + table.version() + " has an incomplete tax bracket");
            }
            if (previous == null && bracket.lowerBound().signum() != 0) {
                throw new ConfigException("First tax bracket must start at 0, got " + bracket.lowerBound());
            }
            if (previous != null && bracket.lowerBound().compareTo(previous) <= 0) {
                throw new ConfigException("Tax bracket lower bounds must be strictly ascending at " + bracket.lowerBound());
            }
            requireRate(table, "tax bracket rate", bracket.rate());
            previous = bracket.lowerBound();
        }
        requireRate(table, "superGuaranteeRate", table.superGuaranteeRate());
        requireRate(table, "contributionsTaxRate", table.contributionsTaxRate());
        requireRate(table, "medicareLevyRate", table.medicareLevyRate());
        if (table.concessionalCap() == null || table.concessionalCap().signum() <= 0) {
            throw new ConfigException("Rule table " + table.version() + " needs a positive concessionalCap");
        }
    }

    private static void requireRate(RuleTable table, String name, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigException("Rule table " + table.version() + ": " + name + " must be within [0,1], got " + rate);
        }
    }

    private ObjectMapper mapperFor(Resource resource) {
        String name = resource.getFilename() == null ? "" : resource.getFilename().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
    }

    private static String describe(Resource resource) {
        return resource == null ? "<none>" : resource.getDescription();
    }
}
