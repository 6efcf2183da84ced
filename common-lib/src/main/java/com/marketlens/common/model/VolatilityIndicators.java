package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latest raw volatility readings next to the bucketed label.
 * Numeric fields are {@code null} when the series is too short to define them.
 */
public record VolatilityIndicators(
    @JsonProperty("bollinger_bands_width") Double bollingerBandsWidth,
    @JsonProperty("average_true_range") Double averageTrueRange,
    @JsonProperty("volatility_level") VolatilityLevel volatilityLevel
) {}
