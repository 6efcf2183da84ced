package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonValue;
import com.marketlens.common.model.Trend;

public enum Direction {
    BULLISH("bullish"),
    BEARISH("bearish");

    private final String wireValue;

    Direction(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean alignsWith(Trend trend) {
        return (this == BULLISH && trend == Trend.BULLISH)
            || (this == BEARISH && trend == Trend.BEARISH);
    }

    /** +1 for bullish, −1 for bearish. */
    public int sign() {
        return this == BULLISH ? 1 : -1;
    }
}
