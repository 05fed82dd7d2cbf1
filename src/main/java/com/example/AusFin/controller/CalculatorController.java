package com.example.AusFin.controller;

import com.example.AusFin.model.CalculationResult;
import com.example.AusFin.model.RetirementRequest;
import com.example.AusFin.model.SuperOptimisationRequest;
import com.example.AusFin.model.UserProfile;
import com.example.AusFin.service.FinancialCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Direct access to the deterministic calculators, no retrieval or generation.
 */
@RestController
@RequestMapping("/api/calculator")
@RequiredArgsConstructor
public class CalculatorController {

    private final FinancialCalculator financialCalculator;

    @PostMapping("/emergency-fund")
    public CalculationResult emergencyFund(@RequestBody UserProfile profile) {
        return financialCalculator.emergencyFund(profile);
    }

    @PostMapping("/super")
    public CalculationResult superOptimisation(@RequestBody SuperOptimisationRequest request) {
        return financialCalculator.superOptimisation(request.profile(), request.desiredSacrifice());
    }

    @PostMapping("/allocation")
    public CalculationResult allocation(@RequestBody UserProfile profile) {
        return financialCalculator.allocationStrategy(profile);
    }

    @PostMapping("/income-tax")
    public CalculationResult incomeTax(@RequestBody UserProfile profile) {
        return financialCalculator.incomeTax(profile);
    }

    @PostMapping("/risk-profile")
    public CalculationResult riskProfile(@RequestBody UserProfile profile) {
        return financialCalculator.riskProfile(profile);
    }

    @PostMapping("/retirement")
    public CalculationResult retirement(@RequestBody RetirementRequest request) {
        return financialCalculator.retirementProjection(
                request.profile(),
                request.resolveRetirementAge(),
                request.resolveExpectedReturn()
        );
    }
}
