package com.example.AusFin.support;

import com.example.AusFin.model.RiskTolerance;
import com.example.AusFin.model.RuleTable;
import com.example.AusFin.model.TaxBracket;
import com.example.AusFin.model.UserProfile;

import java.math.BigDecimal;
import java.util.List;

/**
 * Rule table and profiles shared by the unit tests. Mirrors rules/au-2024-25.yaml.
 */
public final class TestRules {

    private TestRules() {
    }

    public static RuleTable au2024() {
        return new RuleTable(
                "AU-2024-25",
                List.of(
                        bracket("0", "0.00"),
                        bracket("18200", "0.16"),
                        bracket("45000", "0.30"),
                        bracket("135000", "0.37"),
                        bracket("190000", "0.45")
                ),
                new BigDecimal("0.115"),
                new BigDecimal("30000"),
                new BigDecimal("0.15"),
                new BigDecimal("0.02")
        );
    }

    public static UserProfile profile(int age, String income, String monthlyExpenses, RiskTolerance tolerance) {
        return new UserProfile(age, new BigDecimal(income), new BigDecimal(monthlyExpenses), tolerance,
                new BigDecimal("60000"), false, null);
    }

    /**
     * 35 years old, $75,000 a year, $3,000 a month of expenses, balanced.
     */
    public static UserProfile typicalProfile() {
        return profile(35, "75000", "3000", RiskTolerance.BALANCED);
    }

    private static TaxBracket bracket(String lowerBound, String rate) {
        return new TaxBracket(new BigDecimal(lowerBound), new BigDecimal(rate));
    }
}
