package com.example.AusFin.model;

import java.math.BigDecimal;

/**
 * Snapshot of the caller's finances for a single request. Never mutated by the pipeline;
 * range checks happen in {@code FinancialCalculator} so that bad input surfaces as
 * {@code InvalidProfileException} instead of a deserialization error.
 *
 * @param age             age in years
 * @param annualIncome    gross annual income (AUD)
 * @param monthlyExpenses essential monthly expenses (AUD)
 * @param riskTolerance   conservative / balanced / growth
 * @param superBalance    current superannuation balance (AUD)
 * @param variableIncome  true when income is irregular (contractors, commission, seasonal work)
 * @param dependents      number of financial dependents, null when not given
 */
public record UserProfile(
        int age,
        BigDecimal annualIncome,
        BigDecimal monthlyExpenses,
        RiskTolerance riskTolerance,
        BigDecimal superBalance,
        boolean variableIncome,
        Integer dependents
) {
    public RiskTolerance resolveRiskTolerance() {
        return riskTolerance == null ? RiskTolerance.BALANCED : riskTolerance;
    }

    public int resolveDependents() {
        return dependents == null ? 0 : dependents;
    }

    public BigDecimal resolveSuperBalance() {
        return superBalance == null ? BigDecimal.ZERO : superBalance;
    }
}
