package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MarketAssessment(
    @JsonProperty("trend") Trend trend,
    @JsonProperty("volatility") VolatilityLevel volatility,
    @JsonProperty("confidence") double confidence
) {
    public MarketAssessment {
        confidence = Scores.clamp(confidence);
    }
}
