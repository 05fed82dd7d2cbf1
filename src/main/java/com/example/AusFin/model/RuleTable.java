package com.example.AusFin.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Versioned Australian tax and super parameters. Loaded once, read-only afterwards.
 *
 * @param version              label such as "AU-2024-25"
 * @param taxBrackets          resident brackets ordered by ascending lower bound, first bound is 0
 * @param superGuaranteeRate   employer super guarantee rate
 * @param concessionalCap      annual concessional contributions cap
 * @param contributionsTaxRate tax on concessional contributions inside the fund
 * @param medicareLevyRate     Medicare levy rate
 */
public record RuleTable(
        String version,
        List<TaxBracket> taxBrackets,
        BigDecimal superGuaranteeRate,
        BigDecimal concessionalCap,
        BigDecimal contributionsTaxRate,
        BigDecimal medicareLevyRate
) {
    public RuleTable {
        taxBrackets = taxBrackets == null ? List.of() : List.copyOf(taxBrackets);
    }
}
