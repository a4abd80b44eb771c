package com.landdev.cashflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a budget item's amount is spread across its periods
 */
public enum TimingMethod {
    LUMP("lump"),               // Entire amount in the start period
    DISTRIBUTED("distributed"), // Even split across periods_to_complete
    CURVE("curve");             // Logistic S-curve weights

    private final String value;

    TimingMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup, absent or blank values fall back to DISTRIBUTED
     */
    @JsonCreator
    public static TimingMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DISTRIBUTED;
        }
        for (TimingMethod method : values()) {
            if (method.value.equalsIgnoreCase(value.trim()) || method.name().equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown timing method: " + value);
    }
}
