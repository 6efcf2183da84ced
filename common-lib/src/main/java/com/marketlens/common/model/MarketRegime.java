package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse market-state label derived from the external market-context snapshot.
 * Used by {@link com.marketlens.common.scoring.RiskAdjustedRecommender} to adjust
 * the base recommendation.
 */
public enum MarketRegime {
    BULL_MARKET("bull_market"),
    BEAR_MARKET("bear_market"),
    RANGE_BOUND("range_bound"),
    TRANSITIONAL("transitional"),
    UNKNOWN("unknown");

    private final String wireValue;

    MarketRegime(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
