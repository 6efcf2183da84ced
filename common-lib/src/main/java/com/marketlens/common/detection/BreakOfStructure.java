package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Close beyond the most recent swing high / low. {@code strength} is the percentage
 * overshoot past {@code level}.
 */
public record BreakOfStructure(
    @JsonProperty("level") double level,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("strength") double strength,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
