package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Price / RSI-14 disagreement at a swing extreme. {@code strength} is twice the RSI delta
 * against the prior swing.
 */
public record RsiDivergence(
    @JsonProperty("type") Direction type,
    @JsonProperty("rsi_value") double rsiValue,
    @JsonProperty("strength") double strength,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
