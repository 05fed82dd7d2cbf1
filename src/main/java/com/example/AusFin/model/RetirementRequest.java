package com.example.AusFin.model;

import java.math.BigDecimal;

public record RetirementRequest(
        UserProfile profile,
        Integer retirementAge,
        BigDecimal expectedReturn
) {
    public static final int DEFAULT_RETIREMENT_AGE = 67;
    public static final BigDecimal DEFAULT_EXPECTED_RETURN = new BigDecimal("0.07");

    public int resolveRetirementAge() {
        return retirementAge == null ? DEFAULT_RETIREMENT_AGE : retirementAge;
    }

    public BigDecimal resolveExpectedReturn() {
        return expectedReturn == null ? DEFAULT_EXPECTED_RETURN : expectedReturn;
    }
}
