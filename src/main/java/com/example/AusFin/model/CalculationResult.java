package com.example.AusFin.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named figures produced by one calculator operation.
 *
 * @param type        operation that produced the figures
 * @param ruleVersion rule table version used, for reproducibility
 * @param fields      figure name to value, in insertion order; currency at scale 2, rates at scale 4
 * @param warnings    non-fatal notes such as an over-cap salary sacrifice
 */
public record CalculationResult(
        CalculationType type,
        String ruleVersion,
        Map<String, BigDecimal> fields,
        List<String> warnings
) {
    public CalculationResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public BigDecimal field(String name) {
        return fields.get(name);
    }

    public BigDecimal headline() {
        return fields.get(type.headlineField());
    }
}
