package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonValue;
import com.marketlens.common.model.Trend;

/**
 * Demand zones form on bullish candles, supply zones on bearish ones.
 */
public enum ZoneType {
    DEMAND("demand"),
    SUPPLY("supply");

    private final String wireValue;

    ZoneType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean alignsWith(Trend trend) {
        return (this == DEMAND && trend == Trend.BULLISH)
            || (this == SUPPLY && trend == Trend.BEARISH);
    }
}
