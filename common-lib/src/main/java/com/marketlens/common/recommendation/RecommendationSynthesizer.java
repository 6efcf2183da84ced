package com.marketlens.common.recommendation;

import com.marketlens.common.detection.BreakOfStructure;
import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.detection.RsiDivergence;
import com.marketlens.common.model.Action;
import com.marketlens.common.model.CandleSeries;
import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.Recommendation;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;

import java.util.Locale;

/**
 * Fuses the classifier output and the detector lists into one {@link Recommendation}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Trend score: BULLISH=+1, BEARISH=−1, otherwise 0.</li>
 *   <li>Volatility score: HIGH=−0.5, LOW=+0.5, otherwise 0.</li>
 *   <li>RSI-divergence score: ±0.5 per bullish / bearish divergence, summed.</li>
 *   <li>Structure score: ±0.3 per bullish / bearish break of structure, summed.</li>
 *   <li>{@code total} = sum of the four; confidence = min(100, |total| × 100).</li>
 * </ol>
 *
 * <h3>Action thresholds</h3>
 * <pre>
 *   total &gt;  0.5  → BUY   target = close × 1.03, stop = close − 1.5 × ATR
 *   total &lt; −0.5  → SELL  target = close × 0.97, stop = close + 1.5 × ATR
 *   otherwise     → HOLD  no target, no stop
 * </pre>
 *
 * <p>When ATR is undefined the stop is left out rather than guessed.
 * This class is stateless and thread-safe.
 */
public final class RecommendationSynthesizer {

    static final double BUY_THRESHOLD  =  0.5;
    static final double SELL_THRESHOLD = -0.5;

    static final double DIVERGENCE_WEIGHT = 0.5;
    static final double STRUCTURE_WEIGHT  = 0.3;

    static final double BUY_TARGET_FACTOR  = 1.03;
    static final double SELL_TARGET_FACTOR = 0.97;
    static final double STOP_ATR_MULTIPLE  = 1.5;

    private RecommendationSynthesizer() {}

    /**
     * Per-factor breakdown of the fused score.
     */
    public record SignalScore(double trend, double volatility, double rsiDivergence, double structure) {
        public double total() {
            return trend + volatility + rsiDivergence + structure;
        }
    }

    public static Recommendation synthesize(CandleSeries series, MarketAssessment assessment,
                                            DetectionSet detections) {
        SignalScore score = score(assessment, detections);
        double total = score.total();
        Action action = deriveAction(total);
        double confidence = Math.min(100.0, Math.abs(total) * 100);

        String reasoning = String.format(Locale.ROOT,
            "Based on trend analysis (%s), volatility (%s), and technical indicators. Score: %.2f",
            assessment.trend().wireValue(), assessment.volatility().wireValue(), total);

        if (action == Action.HOLD) {
            return Recommendation.hold(confidence, reasoning);
        }

        double close = series.lastClose();
        double atr   = series.indicators().atr14(series.lastIndex());
        Double stop  = Double.isNaN(atr) ? null
            : action == Action.BUY ? close - atr * STOP_ATR_MULTIPLE : close + atr * STOP_ATR_MULTIPLE;
        double target = action == Action.BUY ? close * BUY_TARGET_FACTOR : close * SELL_TARGET_FACTOR;

        return new Recommendation(action, confidence, reasoning, target, stop);
    }

    public static SignalScore score(MarketAssessment assessment, DetectionSet detections) {
        double trendScore = assessment.trend() == Trend.BULLISH ? 1
            : assessment.trend() == Trend.BEARISH ? -1 : 0;

        double volatilityScore = assessment.volatility() == VolatilityLevel.HIGH ? -0.5
            : assessment.volatility() == VolatilityLevel.LOW ? 0.5 : 0;

        double divergenceScore = 0;
        for (RsiDivergence d : detections.rsiDivergence()) {
            divergenceScore += d.type().sign() * DIVERGENCE_WEIGHT;
        }

        double structureScore = 0;
        for (BreakOfStructure b : detections.breakOfStructure()) {
            structureScore += b.direction().sign() * STRUCTURE_WEIGHT;
        }

        return new SignalScore(trendScore, volatilityScore, divergenceScore, structureScore);
    }

    static Action deriveAction(double total) {
        if (total > BUY_THRESHOLD)  return Action.BUY;
        if (total < SELL_THRESHOLD) return Action.SELL;
        return Action.HOLD;
    }
}
