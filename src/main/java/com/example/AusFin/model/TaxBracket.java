package com.example.AusFin.model;

import java.math.BigDecimal;

/**
 * @param lowerBound inclusive lower bound of taxable income for this rate
 * @param rate       marginal rate as a fraction (0.30 = 30%)
 */
public record TaxBracket(BigDecimal lowerBound, BigDecimal rate) {
}
