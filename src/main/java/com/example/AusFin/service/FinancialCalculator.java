package com.example.AusFin.service;

import com.example.AusFin.exception.InvalidProfileException;
import com.example.AusFin.model.CalculationResult;
import com.example.AusFin.model.CalculationType;
import com.example.AusFin.model.RiskTolerance;
import com.example.AusFin.model.RuleTable;
import com.example.AusFin.model.TaxBracket;
import com.example.AusFin.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic Australian personal-finance figures.
 *
 * Every operation is a pure function of the profile and the rule table supplied at
 * construction: the same inputs always give the same fields. Money is BigDecimal,
 * currency rounded HALF_UP to cents, rates to 4 decimal places.
 */
@Service
public class FinancialCalculator {

    private static final Logger log = LoggerFactory.getLogger(FinancialCalculator.class);

    private static final int CURRENCY_SCALE = 2;
    private static final int RATE_SCALE = 4;
    private static final int MAX_AGE = 120;

    private static final BigDecimal STANDARD_MONTHS = BigDecimal.valueOf(6);
    private static final BigDecimal CONSERVATIVE_VARIABLE_MONTHS = BigDecimal.valueOf(9);

    private static final BigDecimal DEFAULT_SACRIFICE_SHARE = new BigDecimal("0.10");

    private static final int GROWTH_BASE = 110;
    private static final int GROWTH_FLOOR = 20;
    private static final int RISK_ADJUSTMENT = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal AUSTRALIAN_EQUITY_SHARE = new BigDecimal("0.40");
    private static final BigDecimal INTERNATIONAL_EQUITY_SHARE = new BigDecimal("0.60");
    private static final BigDecimal FIXED_INCOME_SHARE = new BigDecimal("0.70");
    private static final BigDecimal CASH_SHARE = new BigDecimal("0.30");

    private static final BigDecimal HIGH_INCOME = BigDecimal.valueOf(150_000);
    private static final BigDecimal MODERATE_INCOME = BigDecimal.valueOf(75_000);
    private static final BigDecimal HIGH_SAVINGS_RATE = new BigDecimal("0.30");
    private static final BigDecimal MODERATE_SAVINGS_RATE = new BigDecimal("0.15");
    private static final BigDecimal LOW_SAVINGS_RATE = new BigDecimal("0.05");
    private static final int GROWTH_SCORE = 4;
    private static final int BALANCED_SCORE = 2;

    private static final BigDecimal SAFE_WITHDRAWAL_RATE = new BigDecimal("0.04");
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final RuleTable rules;

    public FinancialCalculator(RuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public String ruleVersion() {
        return rules.version();
    }

    /**
     * Six months of essential expenses; nine when a conservative saver has irregular income.
     */
    public CalculationResult emergencyFund(UserProfile profile) {
        validate(profile);
        boolean extended = profile.resolveRiskTolerance() == RiskTolerance.CONSERVATIVE && profile.variableIncome();
        BigDecimal months = extended ? CONSERVATIVE_VARIABLE_MONTHS : STANDARD_MONTHS;

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("recommended_emergency_fund", currency(profile.monthlyExpenses().multiply(months)));
        fields.put("monthly_expenses", currency(profile.monthlyExpenses()));
        fields.put("months_covered", months);
        return result(CalculationType.EMERGENCY_FUND, fields, List.of());
    }

    /**
     * Salary sacrifice analysis. Sacrifice above the concessional cap is reported as
     * {@code excess_sacrifice} with a warning and earns no tax saving.
     *
     * @param desiredSacrifice annual sacrifice; null picks min(10% of income, cap headroom after SG)
     */
    public CalculationResult superOptimisation(UserProfile profile, BigDecimal desiredSacrifice) {
        validate(profile);
        if (desiredSacrifice != null && desiredSacrifice.signum() < 0) {
            throw new InvalidProfileException("desired salary sacrifice must not be negative: " + desiredSacrifice);
        }
        BigDecimal income = profile.annualIncome();
        BigDecimal marginalRate = marginalRate(income);
        BigDecimal cap = rules.concessionalCap();
        BigDecimal employerContribution = currency(income.multiply(rules.superGuaranteeRate()));

        BigDecimal sacrifice = desiredSacrifice != null
                ? currency(desiredSacrifice)
                : defaultSacrifice(income, employerContribution);
        BigDecimal withinCap = sacrifice.min(cap);
        BigDecimal excess = sacrifice.subtract(cap).max(BigDecimal.ZERO);

        BigDecimal contributionsTax = rules.contributionsTaxRate();
        BigDecimal afterTaxContribution = withinCap.multiply(BigDecimal.ONE.subtract(contributionsTax));
        BigDecimal taxSaving = withinCap.multiply(marginalRate.subtract(contributionsTax)).max(BigDecimal.ZERO);
        BigDecimal takeHomeReduction = sacrifice.multiply(BigDecimal.ONE.subtract(marginalRate));

        List<String> warnings = new ArrayList<>();
        if (excess.signum() > 0) {
            warnings.add("Salary sacrifice exceeds the concessional cap of " + currency(cap).toPlainString()
                    + " by " + currency(excess).toPlainString()
                    + "; the excess is taxed at your marginal rate and earns no saving.");
        }

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("marginal_tax_rate", rate(marginalRate));
        fields.put("super_guarantee_rate", rate(rules.superGuaranteeRate()));
        fields.put("employer_contribution", employerContribution);
        fields.put("concessional_cap", currency(cap));
        fields.put("desired_sacrifice", sacrifice);
        fields.put("concessional_sacrifice", currency(withinCap));
        fields.put("excess_sacrifice", currency(excess));
        fields.put("after_tax_super_contribution", currency(afterTaxContribution));
        fields.put("annual_tax_saving", currency(taxSaving));
        fields.put("take_home_reduction", currency(takeHomeReduction));
        return result(CalculationType.SUPER_OPTIMISATION, fields, warnings);
    }

    /**
     * Age-based growth/defensive split, shifted ten points by risk tolerance.
     * The four asset-class weights always sum to exactly 100.00.
     */
    public CalculationResult allocationStrategy(UserProfile profile) {
        validate(profile);
        int growth = Math.min(100, Math.max(GROWTH_FLOOR, GROWTH_BASE - profile.age()));
        growth += switch (profile.resolveRiskTolerance()) {
            case CONSERVATIVE -> -RISK_ADJUSTMENT;
            case BALANCED -> 0;
            case GROWTH -> RISK_ADJUSTMENT;
        };
        growth = Math.max(0, Math.min(100, growth));

        BigDecimal growthPct = BigDecimal.valueOf(growth);
        BigDecimal defensivePct = HUNDRED.subtract(growthPct);

        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        weights.put("australian_equities_pct", growthPct.multiply(AUSTRALIAN_EQUITY_SHARE));
        weights.put("international_equities_pct", growthPct.multiply(INTERNATIONAL_EQUITY_SHARE));
        weights.put("fixed_income_pct", defensivePct.multiply(FIXED_INCOME_SHARE));
        weights.put("cash_pct", defensivePct.multiply(CASH_SHARE));
        renormalise(weights);

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("growth_assets_pct", percent(growthPct));
        fields.put("defensive_assets_pct", percent(defensivePct));
        fields.putAll(weights);
        return result(CalculationType.ALLOCATION, fields, List.of());
    }

    /**
     * Resident income tax on the bracket table plus the flat Medicare levy.
     */
    public CalculationResult incomeTax(UserProfile profile) {
        validate(profile);
        BigDecimal income = profile.annualIncome();
        BigDecimal incomeTax = progressiveTax(income);
        BigDecimal medicare = income.multiply(rules.medicareLevyRate());
        BigDecimal total = incomeTax.add(medicare);
        BigDecimal averageRate = income.signum() == 0
                ? BigDecimal.ZERO
                : total.divide(income, RATE_SCALE, RoundingMode.HALF_UP);

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("taxable_income", currency(income));
        fields.put("income_tax", currency(incomeTax));
        fields.put("medicare_levy", currency(medicare));
        fields.put("tax_payable", currency(total));
        fields.put("marginal_tax_rate", rate(marginalRate(income)));
        fields.put("average_tax_rate", rate(averageRate));
        fields.put("after_tax_income", currency(income.subtract(total)));
        return result(CalculationType.INCOME_TAX, fields, List.of());
    }

    /**
     * Future value of the current balance plus employer SG (net of contributions tax),
     * compounded annually, and the income a 4% drawdown would give at retirement.
     */
    public CalculationResult retirementProjection(UserProfile profile, int retirementAge, BigDecimal expectedReturn) {
        validate(profile);
        if (retirementAge <= profile.age() || retirementAge > MAX_AGE) {
            throw new InvalidProfileException("retirement age must be after the current age and at most "
                    + MAX_AGE + ", got " + retirementAge);
        }
        if (expectedReturn == null || expectedReturn.compareTo(BigDecimal.ONE.negate()) <= 0
                || expectedReturn.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidProfileException("expected return must be within (-1, 1], got " + expectedReturn);
        }
        int years = retirementAge - profile.age();
        BigDecimal balance = profile.resolveSuperBalance();
        BigDecimal netContribution = profile.annualIncome()
                .multiply(rules.superGuaranteeRate())
                .multiply(BigDecimal.ONE.subtract(rules.contributionsTaxRate()));

        BigDecimal projected;
        if (expectedReturn.signum() == 0) {
            projected = balance.add(netContribution.multiply(BigDecimal.valueOf(years)));
        } else {
            BigDecimal growthFactor = BigDecimal.ONE.add(expectedReturn).pow(years, MathContext.DECIMAL64);
            BigDecimal annuityFactor = growthFactor.subtract(BigDecimal.ONE)
                    .divide(expectedReturn, MathContext.DECIMAL64);
            projected = balance.multiply(growthFactor).add(netContribution.multiply(annuityFactor));
        }
        BigDecimal annualIncome = projected.multiply(SAFE_WITHDRAWAL_RATE);

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("years_to_retirement", BigDecimal.valueOf(years));
        fields.put("current_super_balance", currency(balance));
        fields.put("annual_net_contribution", currency(netContribution));
        fields.put("expected_return_rate", rate(expectedReturn));
        fields.put("projected_super_balance", currency(projected));
        fields.put("annual_retirement_income", currency(annualIncome));
        fields.put("monthly_retirement_income", currency(annualIncome.divide(MONTHS_PER_YEAR, MathContext.DECIMAL64)));
        return result(CalculationType.RETIREMENT_PROJECTION, fields, List.of());
    }

    /**
     * Risk capacity score from age, income, savings rate and dependents, and the risk
     * tolerance it supports. Score 4 and up suggests growth, 2 to 3 balanced, below that
     * conservative. The contributing factors come back as notes, followed by a warning
     * when the stated tolerance is more aggressive than the recommendation.
     */
    public CalculationResult riskProfile(UserProfile profile) {
        validate(profile);
        BigDecimal income = profile.annualIncome();
        BigDecimal annualExpenses = profile.monthlyExpenses().multiply(MONTHS_PER_YEAR);
        BigDecimal disposable = income.subtract(annualExpenses);
        BigDecimal savingsRate = income.signum() == 0
                ? BigDecimal.ZERO
                : disposable.divide(income, RATE_SCALE, RoundingMode.HALF_UP);

        List<String> notes = new ArrayList<>();
        int score;
        if (profile.age() < 30) {
            score = 3;
            notes.add("Young age allows a long-term growth focus.");
        } else if (profile.age() < 45) {
            score = 2;
            notes.add("Mid-career allows moderate risk taking.");
        } else if (profile.age() < 60) {
            score = 1;
            notes.add("Pre-retirement calls for a balanced approach.");
        } else {
            score = 0;
            notes.add("Near or in retirement suggests a conservative approach.");
        }

        if (income.compareTo(HIGH_INCOME) > 0) {
            score += 2;
            notes.add("High income provides a risk buffer.");
        } else if (income.compareTo(MODERATE_INCOME) > 0) {
            score += 1;
            notes.add("Moderate income allows some risk.");
        }

        if (savingsRate.compareTo(HIGH_SAVINGS_RATE) > 0) {
            score += 2;
            notes.add("High savings rate supports taking risk.");
        } else if (savingsRate.compareTo(MODERATE_SAVINGS_RATE) > 0) {
            score += 1;
            notes.add("Moderate savings rate supports a balanced approach.");
        } else if (savingsRate.compareTo(LOW_SAVINGS_RATE) < 0) {
            score -= 1;
            notes.add("Low savings rate suggests a conservative approach.");
        }

        int dependents = profile.resolveDependents();
        if (dependents > 0) {
            score -= dependents;
            notes.add(dependents + " financial dependent" + (dependents == 1 ? "" : "s") + " call for a security focus.");
        }

        RiskTolerance recommended = score >= GROWTH_SCORE
                ? RiskTolerance.GROWTH
                : score >= BALANCED_SCORE ? RiskTolerance.BALANCED : RiskTolerance.CONSERVATIVE;
        notes.add(0, "Recommended risk tolerance: " + recommended.value() + ".");
        if (profile.riskTolerance() != null && profile.riskTolerance().ordinal() > recommended.ordinal()) {
            notes.add("Stated risk tolerance " + profile.riskTolerance().value()
                    + " is more aggressive than your circumstances support.");
        }

        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        fields.put("risk_score", BigDecimal.valueOf(score));
        fields.put("savings_rate", savingsRate);
        fields.put("disposable_income", currency(disposable));
        fields.put("dependents", BigDecimal.valueOf(dependents));
        return result(CalculationType.RISK_PROFILE, fields, notes);
    }

    /**
     * Rejects profiles no calculation can use. Called by every operation and by the
     * pipeline before retrieval, so an invalid profile never gets silently ignored.
     */
    public void validate(UserProfile profile) {
        if (profile == null) {
            throw new InvalidProfileException("a financial profile is required for this calculation");
        }
        if (profile.age() <= 0 || profile.age() > MAX_AGE) {
            throw new InvalidProfileException("age must be between 1 and " + MAX_AGE + ", got " + profile.age());
        }
        requireNonNegative("annualIncome", profile.annualIncome());
        requireNonNegative("monthlyExpenses", profile.monthlyExpenses());
        if (profile.superBalance() != null && profile.superBalance().signum() < 0) {
            throw new InvalidProfileException("superBalance must not be negative, got " + profile.superBalance());
        }
        if (profile.dependents() != null && profile.dependents() < 0) {
            throw new InvalidProfileException("dependents must not be negative, got " + profile.dependents());
        }
    }

    /**
     * Rate of the last bracket whose lower bound is at or below the income.
     */
    BigDecimal marginalRate(BigDecimal income) {
        BigDecimal rate = BigDecimal.ZERO;
        for (TaxBracket bracket : rules.taxBrackets()) {
            if (bracket.lowerBound().compareTo(income) <= 0) {
                rate = bracket.rate();
            } else {
                break;
            }
        }
        return rate;
    }

    private BigDecimal progressiveTax(BigDecimal income) {
        List<TaxBracket> brackets = rules.taxBrackets();
        BigDecimal tax = BigDecimal.ZERO;
        for (int i = 0; i < brackets.size(); i++) {
            TaxBracket bracket = brackets.get(i);
            if (income.compareTo(bracket.lowerBound()) <= 0) {
                break;
            }
            BigDecimal upper = i + 1 < brackets.size() ? brackets.get(i + 1).lowerBound() : income;
            BigDecimal taxable = income.min(upper).subtract(bracket.lowerBound());
            tax = tax.add(taxable.multiply(bracket.rate()));
        }
        return tax;
    }

    private BigDecimal defaultSacrifice(BigDecimal income, BigDecimal employerContribution) {
        BigDecimal headroom = rules.concessionalCap().subtract(employerContribution);
        return currency(income.multiply(DEFAULT_SACRIFICE_SHARE).min(headroom).max(BigDecimal.ZERO));
    }

    /**
     * Rounds each weight to 2dp and gives the rounding residual to the largest weight,
     * so the total is exactly 100.00.
     */
    private static void renormalise(Map<String, BigDecimal> weights) {
        BigDecimal total = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        String largest = null;
        BigDecimal rounded = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
            BigDecimal scaled = total.signum() == 0
                    ? BigDecimal.ZERO
                    : entry.getValue().multiply(HUNDRED).divide(total, MathContext.DECIMAL64);
            BigDecimal value = percent(scaled);
            entry.setValue(value);
            rounded = rounded.add(value);
            if (largest == null || value.compareTo(weights.get(largest)) > 0) {
                largest = entry.getKey();
            }
        }
        BigDecimal residual = percent(HUNDRED).subtract(rounded);
        if (residual.signum() != 0 && largest != null) {
            log.debug("Allocation rounding residual {} assigned to {}", residual, largest);
            weights.put(largest, weights.get(largest).add(residual));
        }
    }

    private CalculationResult result(CalculationType type, Map<String, BigDecimal> fields, List<String> warnings) {
        return new CalculationResult(type, rules.version(), fields, warnings);
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value == null) {
            throw new InvalidProfileException(name + " is required");
        }
        if (value.signum() < 0) {
            throw new InvalidProfileException(name + " must not be negative, got " + value);
        }
    }

    private static BigDecimal currency(BigDecimal value) {
        return value.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal value) {
        return value.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal rate(BigDecimal value) {
        return value.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }
}
