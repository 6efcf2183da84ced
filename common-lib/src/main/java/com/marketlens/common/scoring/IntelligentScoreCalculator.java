package com.marketlens.common.scoring;

import com.marketlens.common.detection.BreakOfStructure;
import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.detection.FairValueGap;
import com.marketlens.common.detection.OrderBlock;
import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.Recommendation;
import com.marketlens.common.model.Scores;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;

/**
 * Stateless calculator that turns the local assessment, the detections and the synthesized
 * recommendation into a 0–100 intelligent score, weighting institutional structure higher.
 *
 * <p><b>Formula</b>:
 * <pre>
 *   score  = 50
 *   score += ±15                      trend BULLISH / BEARISH
 *   score += −10 | +5                 volatility HIGH / LOW
 *   score += 0.5 × strength           per order block aligned with the trend (demand↔bullish)
 *   score += 0.3 × strength           per break of structure in the trend direction
 *   score += 15                       per fair value gap in the trend direction
 *   score += 8                        context sentiment equals the trend
 *   score  = clamp((score + recommendation.confidence) / 2, 0, 100)
 * </pre>
 *
 * <p>Alignment bonuses never fire for a SIDEWAYS or UNKNOWN trend. A missing context simply
 * skips the sentiment bonus.
 */
public final class IntelligentScoreCalculator {

    static final double BASE_SCORE            = 50;
    static final double TREND_WEIGHT          = 15;
    static final double HIGH_VOLATILITY_DELTA = -10;
    static final double LOW_VOLATILITY_DELTA  = 5;
    static final double ORDER_BLOCK_COEFF     = 0.5;
    static final double STRUCTURE_COEFF       = 0.3;
    static final double FVG_BONUS             = 15;
    static final double SENTIMENT_BONUS       = 8;

    private IntelligentScoreCalculator() {}

    public static double compute(MarketAssessment assessment, DetectionSet detections,
                                 Recommendation recommendation, MarketContext context) {
        Trend trend = assessment.trend();
        double score = BASE_SCORE;

        if (trend == Trend.BULLISH)      score += TREND_WEIGHT;
        else if (trend == Trend.BEARISH) score -= TREND_WEIGHT;

        if (assessment.volatility() == VolatilityLevel.HIGH)     score += HIGH_VOLATILITY_DELTA;
        else if (assessment.volatility() == VolatilityLevel.LOW) score += LOW_VOLATILITY_DELTA;

        for (OrderBlock ob : detections.orderBlocks()) {
            if (ob.type().alignsWith(trend)) score += ob.strength() * ORDER_BLOCK_COEFF;
        }
        for (BreakOfStructure bos : detections.breakOfStructure()) {
            if (bos.direction().alignsWith(trend)) score += bos.strength() * STRUCTURE_COEFF;
        }
        for (FairValueGap fvg : detections.fairValueGaps()) {
            if (fvg.type().alignsWith(trend)) score += FVG_BONUS;
        }

        if (context != null && context.marketSentiment().matches(trend)) {
            score += SENTIMENT_BONUS;
        }

        return Scores.clamp((score + recommendation.confidence()) / 2);
    }
}
