package com.marketlens.analysis.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlens.common.model.Candle;

import java.util.List;

/** A named candle series supplied alongside the primary one (comparison or benchmark). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeriesPayload(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("candles") List<Candle> candles
) {}
