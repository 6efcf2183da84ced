package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelativeStrength {
    OUTPERFORMING("outperforming"),
    UNDERPERFORMING("underperforming"),
    NEUTRAL("neutral");

    private final String wireValue;

    RelativeStrength(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
