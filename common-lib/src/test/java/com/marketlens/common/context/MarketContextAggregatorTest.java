package com.marketlens.common.context;

import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.Sentiment;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketContextAggregatorTest {

    private static MarketAssessment a(Trend trend, VolatilityLevel volatility) {
        return new MarketAssessment(trend, volatility, 50);
    }

    @Test
    @DisplayName("no benchmarks → all UNKNOWN")
    void empty() {
        MarketContext ctx = MarketContextAggregator.aggregate(List.of());
        assertEquals(Sentiment.UNKNOWN, ctx.marketSentiment());
        assertEquals(Trend.UNKNOWN, ctx.benchmarkTrend());
        assertEquals(VolatilityLevel.UNKNOWN, ctx.overallVolatility());
    }

    @Test
    @DisplayName("bullish majority, lead trend from the first benchmark")
    void bullishMajority() {
        MarketContext ctx = MarketContextAggregator.aggregate(List.of(
            a(Trend.SIDEWAYS, VolatilityLevel.LOW),
            a(Trend.BULLISH, VolatilityLevel.LOW),
            a(Trend.BULLISH, VolatilityLevel.HIGH)));
        assertEquals(Sentiment.BULLISH, ctx.marketSentiment());
        assertEquals(Trend.SIDEWAYS, ctx.benchmarkTrend());
        assertEquals(VolatilityLevel.HIGH, ctx.overallVolatility());
    }

    @Test
    @DisplayName("tie → NEUTRAL sentiment; one HIGH benchmark is not averaged away")
    void tie() {
        MarketContext ctx = MarketContextAggregator.aggregate(List.of(
            a(Trend.BULLISH, VolatilityLevel.HIGH),
            a(Trend.BEARISH, VolatilityLevel.LOW)));
        assertEquals(Sentiment.NEUTRAL, ctx.marketSentiment());
        assertEquals(VolatilityLevel.HIGH, ctx.overallVolatility());
    }

    @Test
    @DisplayName("bullish benchmarks with mixed HIGH/LOW volatility → HIGH")
    void mixedVolatilityKeepsHigh() {
        MarketContext ctx = MarketContextAggregator.aggregate(List.of(
            a(Trend.BULLISH, VolatilityLevel.HIGH),
            a(Trend.BULLISH, VolatilityLevel.LOW)));
        assertEquals(Sentiment.BULLISH, ctx.marketSentiment());
        assertEquals(VolatilityLevel.HIGH, ctx.overallVolatility());
    }

    @Test
    @DisplayName("UNKNOWN ranks below every known label")
    void unknownRanksLowest() {
        assertEquals(VolatilityLevel.LOW, MarketContextAggregator.aggregate(List.of(
            a(Trend.UNKNOWN, VolatilityLevel.UNKNOWN),
            a(Trend.SIDEWAYS, VolatilityLevel.LOW))).overallVolatility());
        assertEquals(VolatilityLevel.MODERATE, MarketContextAggregator.aggregate(List.of(
            a(Trend.BEARISH, VolatilityLevel.MODERATE),
            a(Trend.UNKNOWN, VolatilityLevel.UNKNOWN))).overallVolatility());
        assertEquals(VolatilityLevel.UNKNOWN, MarketContextAggregator.aggregate(List.of(
            a(Trend.UNKNOWN, VolatilityLevel.UNKNOWN))).overallVolatility());
    }

    @Test
    @DisplayName("bearish majority with high volatility")
    void bearish() {
        MarketContext ctx = MarketContextAggregator.aggregate(List.of(
            a(Trend.BEARISH, VolatilityLevel.HIGH),
            a(Trend.BEARISH, VolatilityLevel.MODERATE)));
        assertEquals(Sentiment.BEARISH, ctx.marketSentiment());
        assertEquals(Trend.BEARISH, ctx.benchmarkTrend());
        assertEquals(VolatilityLevel.HIGH, ctx.overallVolatility());
    }
}
