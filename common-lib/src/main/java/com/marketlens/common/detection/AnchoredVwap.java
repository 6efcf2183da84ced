package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * VWAP accumulated forward from a local extreme. {@code timestamp} is the anchor candle's.
 */
public record AnchoredVwap(
    @JsonProperty("anchor_point") double anchorPoint,
    @JsonProperty("current_vwap") double currentVwap,
    @JsonProperty("anchor_type") AnchorType anchorType,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
