package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * EMA-9 / EMA-21 crossover. {@code strength} is the EMA gap as a percentage of EMA-21.
 */
public record ChangeOfCharacter(
    @JsonProperty("type") Direction type,
    @JsonProperty("level") double level,
    @JsonProperty("strength") double strength,
    @JsonProperty("timestamp") Instant timestamp
) implements Detection {}
