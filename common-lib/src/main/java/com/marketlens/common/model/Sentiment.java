package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate market sentiment carried by the external context snapshot.
 */
public enum Sentiment {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String wireValue;

    Sentiment(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** True when this sentiment points the same way as a directional local trend. */
    public boolean matches(Trend trend) {
        return (this == BULLISH && trend == Trend.BULLISH)
            || (this == BEARISH && trend == Trend.BEARISH);
    }

    @JsonCreator
    public static Sentiment fromWire(String value) {
        for (Sentiment s : values()) {
            if (s.wireValue.equalsIgnoreCase(value)) return s;
        }
        return UNKNOWN;
    }
}
