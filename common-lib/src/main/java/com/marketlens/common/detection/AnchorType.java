package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnchorType {
    HIGH("high"),
    LOW("low");

    private final String wireValue;

    AnchorType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
