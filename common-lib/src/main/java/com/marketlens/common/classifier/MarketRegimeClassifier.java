package com.marketlens.common.classifier;

import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.MarketRegime;
import com.marketlens.common.model.Sentiment;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;

/**
 * Pure stateless classifier that maps an external {@link MarketContext} snapshot to a
 * {@link MarketRegime}.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>no context                                         → {@link MarketRegime#UNKNOWN}</li>
 *   <li>benchmark BULLISH and volatility LOW or MODERATE   → {@link MarketRegime#BULL_MARKET}</li>
 *   <li>benchmark BEARISH and volatility HIGH              → {@link MarketRegime#BEAR_MARKET}</li>
 *   <li>benchmark SIDEWAYS or sentiment NEUTRAL            → {@link MarketRegime#RANGE_BOUND}</li>
 *   <li>otherwise                                          → {@link MarketRegime#TRANSITIONAL}</li>
 * </ol>
 */
public final class MarketRegimeClassifier {

    private MarketRegimeClassifier() {}

    public static MarketRegime classify(MarketContext context) {
        if (context == null) {
            return MarketRegime.UNKNOWN;
        }
        Trend benchmark = context.benchmarkTrend();
        VolatilityLevel volatility = context.overallVolatility();

        if (benchmark == Trend.BULLISH
                && (volatility == VolatilityLevel.LOW || volatility == VolatilityLevel.MODERATE)) {
            return MarketRegime.BULL_MARKET;
        }
        if (benchmark == Trend.BEARISH && volatility == VolatilityLevel.HIGH) {
            return MarketRegime.BEAR_MARKET;
        }
        if (benchmark == Trend.SIDEWAYS || context.marketSentiment() == Sentiment.NEUTRAL) {
            return MarketRegime.RANGE_BOUND;
        }
        return MarketRegime.TRANSITIONAL;
    }
}
