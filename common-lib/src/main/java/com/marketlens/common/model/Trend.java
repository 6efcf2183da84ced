package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trend label derived from the EMA-9/21/50 stack on the last candle.
 */
public enum Trend {
    BULLISH("bullish"),
    BEARISH("bearish"),
    SIDEWAYS("sideways"),
    UNKNOWN("unknown");

    private final String wireValue;

    Trend(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** True for BULLISH / BEARISH. */
    public boolean isDirectional() {
        return this == BULLISH || this == BEARISH;
    }

    @JsonCreator
    public static Trend fromWire(String value) {
        for (Trend t : values()) {
            if (t.wireValue.equalsIgnoreCase(value)) return t;
        }
        return UNKNOWN;
    }
}
