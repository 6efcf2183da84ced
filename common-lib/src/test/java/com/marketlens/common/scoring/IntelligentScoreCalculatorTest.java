package com.marketlens.common.scoring;

import com.marketlens.common.detection.BreakOfStructure;
import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.detection.FairValueGap;
import com.marketlens.common.detection.OrderBlock;
import com.marketlens.common.detection.ZoneType;
import com.marketlens.common.model.Action;
import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.Recommendation;
import com.marketlens.common.model.Sentiment;
import com.marketlens.common.model.Trend;
import com.marketlens.common.model.VolatilityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.marketlens.common.CandleFixtures.at;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the weighting of {@link IntelligentScoreCalculator}: aligned structure only,
 * sentiment bonus only with context, final average with the recommendation confidence.
 */
class IntelligentScoreCalculatorTest {

    private static final double EPS = 1e-9;
    private static final Recommendation ZERO_HOLD = Recommendation.hold(0, "x");

    private static DetectionSet mixedStructure() {
        return new DetectionSet(
            List.of(new OrderBlock(100, ZoneType.DEMAND, 40, at(1)),
                    new OrderBlock(101, ZoneType.SUPPLY, 80, at(2))),
            List.of(new FairValueGap(102, 101, Direction.BEARISH, at(3))),
            List.of(new BreakOfStructure(99, Direction.BULLISH, 10, at(4))),
            null, null, null, null);
    }

    @Test
    @DisplayName("bullish: aligned OB (+20) and BOS (+3) count, misaligned ones do not, sentiment +8")
    void alignedStructureOnly() {
        double score = IntelligentScoreCalculator.compute(
            new MarketAssessment(Trend.BULLISH, VolatilityLevel.MODERATE, 50), mixedStructure(), ZERO_HOLD,
            MarketContext.of(Sentiment.BULLISH, Trend.BULLISH, VolatilityLevel.LOW));
        // (50 + 15 + 20 + 3 + 8 + 0) / 2
        assertEquals(48.0, score, EPS);
    }

    @Test
    @DisplayName("no context → no sentiment bonus")
    void noContext() {
        double score = IntelligentScoreCalculator.compute(
            new MarketAssessment(Trend.BULLISH, VolatilityLevel.MODERATE, 50), mixedStructure(), ZERO_HOLD, null);
        assertEquals(44.0, score, EPS);
    }

    @Test
    @DisplayName("sideways trend ignores every alignment bonus")
    void sidewaysIgnoresStructure() {
        double score = IntelligentScoreCalculator.compute(
            new MarketAssessment(Trend.SIDEWAYS, VolatilityLevel.LOW, 50), mixedStructure(),
            Recommendation.hold(50, "x"), MarketContext.of(Sentiment.BULLISH, Trend.BULLISH, VolatilityLevel.LOW));
        // (50 + 5 + 50) / 2
        assertEquals(52.5, score, EPS);
    }

    @Test
    @DisplayName("bearish with high volatility and zero confidence floors near 12.5")
    void bearishHighVolatility() {
        double score = IntelligentScoreCalculator.compute(
            new MarketAssessment(Trend.BEARISH, VolatilityLevel.HIGH, 50), DetectionSet.empty(), ZERO_HOLD, null);
        assertEquals(12.5, score, EPS);
    }

    @Test
    @DisplayName("heavily aligned structure is clamped at 100")
    void clampedAtMax() {
        DetectionSet many = new DetectionSet(null,
            List.of(new FairValueGap(2, 1, Direction.BULLISH, at(1)), new FairValueGap(3, 2, Direction.BULLISH, at(2)),
                    new FairValueGap(4, 3, Direction.BULLISH, at(3)), new FairValueGap(5, 4, Direction.BULLISH, at(4)),
                    new FairValueGap(6, 5, Direction.BULLISH, at(5))),
            null, null, null, null, null);
        double score = IntelligentScoreCalculator.compute(
            new MarketAssessment(Trend.BULLISH, VolatilityLevel.LOW, 30), many,
            new Recommendation(Action.BUY, 100, "x", 1.0, 1.0), null);
        assertEquals(100.0, score);
    }
}
