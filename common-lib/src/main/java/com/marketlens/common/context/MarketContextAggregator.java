package com.marketlens.common.context;

import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.Sentiment;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;

import java.util.Comparator;
import java.util.List;

/**
 * Builds a {@link MarketContext} from the assessments of benchmark instruments.
 *
 * <ul>
 *   <li>sentiment — majority of bullish vs bearish benchmark trends; a tie is NEUTRAL,
 *       no benchmarks is UNKNOWN</li>
 *   <li>benchmark trend — trend of the first (lead) benchmark</li>
 *   <li>overall volatility — the most severe benchmark label, LOW &lt; MODERATE &lt; HIGH;
 *       UNKNOWN only when no benchmark has a known label</li>
 * </ul>
 */
public final class MarketContextAggregator {

    private MarketContextAggregator() {}

    public static MarketContext aggregate(List<MarketAssessment> benchmarks) {
        if (benchmarks == null || benchmarks.isEmpty()) {
            return MarketContext.of(Sentiment.UNKNOWN, Trend.UNKNOWN, VolatilityLevel.UNKNOWN);
        }
        return MarketContext.of(
            sentiment(benchmarks),
            benchmarks.get(0).trend(),
            overallVolatility(benchmarks));
    }

    static Sentiment sentiment(List<MarketAssessment> benchmarks) {
        long bullish = benchmarks.stream().filter(a -> a.trend() == Trend.BULLISH).count();
        long bearish = benchmarks.stream().filter(a -> a.trend() == Trend.BEARISH).count();
        if (bullish > bearish) return Sentiment.BULLISH;
        if (bearish > bullish) return Sentiment.BEARISH;
        return Sentiment.NEUTRAL;
    }

    static VolatilityLevel overallVolatility(List<MarketAssessment> benchmarks) {
        return benchmarks.stream()
            .map(MarketAssessment::volatility)
            .max(Comparator.comparingInt(MarketContextAggregator::severity))
            .orElse(VolatilityLevel.UNKNOWN);
    }

    private static int severity(VolatilityLevel level) {
        if (level == null) return 0;
        return switch (level) {
            case LOW      -> 1;
            case MODERATE -> 2;
            case HIGH     -> 3;
            case UNKNOWN  -> 0;
        };
    }
}
