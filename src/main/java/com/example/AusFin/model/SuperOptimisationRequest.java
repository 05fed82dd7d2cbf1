package com.example.AusFin.model;

import java.math.BigDecimal;

/**
 * @param desiredSacrifice annual salary sacrifice; null lets the calculator pick a default
 */
public record SuperOptimisationRequest(UserProfile profile, BigDecimal desiredSacrifice) {
}
