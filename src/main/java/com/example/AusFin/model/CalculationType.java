package com.example.AusFin.model;

/**
 * Calculator operations, each with the field that carries its headline figure.
 */
public enum CalculationType {
    EMERGENCY_FUND("recommended_emergency_fund"),
    SUPER_OPTIMISATION("annual_tax_saving"),
    ALLOCATION("growth_assets_pct"),
    INCOME_TAX("tax_payable"),
    RETIREMENT_PROJECTION("projected_super_balance"),
    RISK_PROFILE("risk_score");

    private final String headlineField;

    CalculationType(String headlineField) {
        this.headlineField = headlineField;
    }

    public String headlineField() {
        return headlineField;
    }
}
