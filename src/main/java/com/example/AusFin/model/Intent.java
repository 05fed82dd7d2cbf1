package com.example.AusFin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory intent detected from the question. Declaration order is the tie-break
 * order when two intents score the same.
 */
public enum Intent {
    EMERGENCY_FUND("emergency-fund"),
    SUPER("super"),
    ALLOCATION("allocation"),
    METALS("metals"),
    STOCKS("stocks"),
    GENERAL("general");

    private final String tag;

    Intent(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static Intent fromTag(String tag) {
        for (Intent intent : values()) {
            if (intent.tag.equalsIgnoreCase(tag) || intent.name().equalsIgnoreCase(tag)) {
                return intent;
            }
        }
        return GENERAL;
    }
}
