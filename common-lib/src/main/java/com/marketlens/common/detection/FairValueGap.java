package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Three-candle imbalance between the outer candles' wicks.
 */
public record FairValueGap(
    @JsonProperty("upper_level") double upperLevel,
    @JsonProperty("lower_level") double lowerLevel,
    @JsonProperty("type") Direction type,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
