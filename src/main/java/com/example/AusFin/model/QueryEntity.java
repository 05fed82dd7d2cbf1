package com.example.AusFin.model;

import java.math.BigDecimal;

/**
 * @param type  entity kind
 * @param text  matched text as it appeared in the question
 * @param value normalised numeric value (amount in AUD, age in years, year); null for tickers
 */
public record QueryEntity(EntityType type, String text, BigDecimal value) {
}
