package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Volatility bucket from ATR-14 expressed as a percentage of the last close.
 */
public enum VolatilityLevel {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    UNKNOWN("unknown");

    private final String wireValue;

    VolatilityLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static VolatilityLevel fromWire(String value) {
        for (VolatilityLevel v : values()) {
            if (v.wireValue.equalsIgnoreCase(value)) return v;
        }
        return UNKNOWN;
    }
}
