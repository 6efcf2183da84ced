package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LiquidityZone(
    @JsonProperty("upper_level") double upperLevel,
    @JsonProperty("lower_level") double lowerLevel,
    @JsonProperty("volume") double volume,
    @JsonProperty("type") ZoneType type,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
