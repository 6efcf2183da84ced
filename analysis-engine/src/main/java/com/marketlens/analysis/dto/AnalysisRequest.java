package com.marketlens.analysis.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlens.common.model.Candle;
import com.marketlens.common.model.MarketContext;

import java.util.List;

/**
 * Body of {@code POST /api/v1/analysis}.
 *
 * <p>{@code comparison}, {@code marketContext} and {@code benchmarks} are optional. An explicit
 * {@code marketContext} wins over one aggregated from {@code benchmarks}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("candles") List<Candle> candles,
    @JsonProperty("comparison") SeriesPayload comparison,
    @JsonProperty("market_context") MarketContext marketContext,
    @JsonProperty("benchmarks") List<SeriesPayload> benchmarks
) {
    public static AnalysisRequest of(String symbol, String timeframe, List<Candle> candles) {
        return new AnalysisRequest(symbol, timeframe, candles, null, null, null);
    }
}
