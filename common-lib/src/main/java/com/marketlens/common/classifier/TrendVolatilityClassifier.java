package com.marketlens.common.classifier;

import com.marketlens.common.indicator.IndicatorSeries;
import com.marketlens.common.model.CandleSeries;
import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityIndicators;
import com.marketlens.common.model.VolatilityLevel;

/**
 * Pure stateless classifier that maps a {@link CandleSeries} to a {@link MarketAssessment}.
 *
 * <h3>Trend (needs {@value #MIN_TREND_CANDLES} candles, else UNKNOWN)</h3>
 * <pre>
 *   close &gt; EMA9 &gt; EMA21 &gt; EMA50  → BULLISH
 *   close &lt; EMA9 &lt; EMA21 &lt; EMA50  → BEARISH
 *   otherwise                     → SIDEWAYS
 * </pre>
 *
 * <h3>Volatility (needs {@value #MIN_VOLATILITY_CANDLES} candles, else UNKNOWN)</h3>
 * <pre>
 *   ATR14 / close × 100 &gt; 5  → HIGH
 *   ATR14 / close × 100 &gt; 2  → MODERATE
 *   otherwise              → LOW
 * </pre>
 *
 * <h3>Confidence</h3>
 * Sum of independent boosts: +20 last volume above its 20-period mean, +25 RSI-14 within
 * [30, 70], +30 directional trend. {@value #DEFAULT_CONFIDENCE} when no boost applies.
 * A heuristic weight, not a probability.
 */
public final class TrendVolatilityClassifier {

    public static final int MIN_TREND_CANDLES      = 50;
    public static final int MIN_VOLATILITY_CANDLES = IndicatorSeries.ATR_PERIOD;

    static final double HIGH_VOLATILITY_PCT     = 5.0;
    static final double MODERATE_VOLATILITY_PCT = 2.0;

    static final double VOLUME_BOOST       = 20;
    static final double RSI_BOOST          = 25;
    static final double TREND_BOOST        = 30;
    static final double DEFAULT_CONFIDENCE = 50;

    private static final double RSI_LOWER = 30;
    private static final double RSI_UPPER = 70;

    private TrendVolatilityClassifier() {}

    public static MarketAssessment assess(CandleSeries series) {
        Trend trend = trend(series);
        return new MarketAssessment(trend, volatility(series), confidence(series, trend));
    }

    public static Trend trend(CandleSeries series) {
        if (series.size() < MIN_TREND_CANDLES) {
            return Trend.UNKNOWN;
        }
        int last = series.lastIndex();
        IndicatorSeries ind = series.indicators();
        double price = series.close(last);
        double ema9  = ind.ema9(last);
        double ema21 = ind.ema21(last);
        double ema50 = ind.ema50(last);

        if (price > ema9 && ema9 > ema21 && ema21 > ema50) return Trend.BULLISH;
        if (price < ema9 && ema9 < ema21 && ema21 < ema50) return Trend.BEARISH;
        return Trend.SIDEWAYS;
    }

    public static VolatilityLevel volatility(CandleSeries series) {
        if (series.size() < MIN_VOLATILITY_CANDLES) {
            return VolatilityLevel.UNKNOWN;
        }
        double atr = series.indicators().atr14(series.lastIndex());
        if (Double.isNaN(atr)) {
            return VolatilityLevel.UNKNOWN;
        }
        double atrPercent = atr / series.lastClose() * 100;
        if (atrPercent > HIGH_VOLATILITY_PCT)     return VolatilityLevel.HIGH;
        if (atrPercent > MODERATE_VOLATILITY_PCT) return VolatilityLevel.MODERATE;
        return VolatilityLevel.LOW;
    }

    static double confidence(CandleSeries series, Trend trend) {
        int last = series.lastIndex();
        IndicatorSeries ind = series.indicators();
        double total = 0;
        boolean boosted = false;

        double volumeMean = ind.volumeMean20(last);
        if (!Double.isNaN(volumeMean) && series.volume(last) > volumeMean) {
            total += VOLUME_BOOST;
            boosted = true;
        }

        double rsi = ind.rsi14(last);
        if (!Double.isNaN(rsi) && rsi >= RSI_LOWER && rsi <= RSI_UPPER) {
            total += RSI_BOOST;
            boosted = true;
        }

        if (trend.isDirectional()) {
            total += TREND_BOOST;
            boosted = true;
        }

        return boosted ? total : DEFAULT_CONFIDENCE;
    }

    /**
     * Latest Bollinger width and ATR alongside the bucketed level; undefined readings are null.
     */
    public static VolatilityIndicators volatilityIndicators(CandleSeries series, VolatilityLevel level) {
        int last = series.lastIndex();
        double width = series.indicators().bollingerWidth20(last);
        double atr   = series.indicators().atr14(last);
        return new VolatilityIndicators(
            Double.isNaN(width) ? null : width,
            Double.isNaN(atr) ? null : atr,
            level);
    }
}
