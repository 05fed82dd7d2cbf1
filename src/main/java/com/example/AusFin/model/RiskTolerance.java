package com.example.AusFin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskTolerance {
    CONSERVATIVE,
    BALANCED,
    GROWTH;

    @JsonCreator
    public static RiskTolerance fromValue(String value) {
        if (value == null) {
            return null;
        }
        return RiskTolerance.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
