package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ComparativeResult(
    @JsonProperty("comparison_symbol") String comparisonSymbol,
    @JsonProperty("correlation") double correlation,
    @JsonProperty("relative_strength") RelativeStrength relativeStrength,
    @JsonProperty("trend_alignment") boolean trendAlignment
) {
    public ComparativeResult {
        correlation = Double.isFinite(correlation) ? Math.max(-1.0, Math.min(1.0, correlation)) : 0.0;
    }
}
