package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * High-volume, wide-bodied candle read as an institutional accumulation (demand)
 * or distribution (supply) zone. {@code level} is the candle close.
 */
public record OrderBlock(
    @JsonProperty("level") double level,
    @JsonProperty("type") ZoneType type,
    @JsonProperty("strength") double strength,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
