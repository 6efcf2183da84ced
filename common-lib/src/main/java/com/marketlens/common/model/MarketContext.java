package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally supplied market-wide snapshot consumed only by the scoring / regime layer.
 *
 * <p>{@code benchmarkTrend} is the trend of the lead benchmark instrument;
 * {@code overallVolatility} is the aggregate volatility bucket across benchmarks.
 * Missing fields are read as UNKNOWN.
 */
public record MarketContext(
    @JsonProperty("market_sentiment") Sentiment marketSentiment,
    @JsonProperty("benchmark_trend") Trend benchmarkTrend,
    @JsonProperty("overall_volatility") VolatilityLevel overallVolatility
) {
    public MarketContext {
        if (marketSentiment == null)   marketSentiment   = Sentiment.UNKNOWN;
        if (benchmarkTrend == null)    benchmarkTrend    = Trend.UNKNOWN;
        if (overallVolatility == null) overallVolatility = VolatilityLevel.UNKNOWN;
    }

    public static MarketContext of(Sentiment sentiment, Trend benchmarkTrend, VolatilityLevel volatility) {
        return new MarketContext(sentiment, benchmarkTrend, volatility);
    }
}
