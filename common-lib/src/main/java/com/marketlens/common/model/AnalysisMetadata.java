package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Descriptive facts about the analysed window. {@code asOf} is the timestamp of the last
 * candle, never the wall clock, so repeated runs over the same input stay identical.
 */
public record AnalysisMetadata(
    @JsonProperty("data_points") int dataPoints,
    @JsonProperty("last_close") double lastClose,
    @JsonProperty("as_of") Instant asOf
) {}
