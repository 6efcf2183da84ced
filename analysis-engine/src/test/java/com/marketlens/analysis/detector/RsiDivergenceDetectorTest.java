package com.marketlens.analysis.detector;

import com.marketlens.analysis.CandleFixtures;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.detection.RsiDivergence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.marketlens.analysis.CandleFixtures.at;
import static org.junit.jupiter.api.Assertions.*;

class RsiDivergenceDetectorTest {

    private final RsiDivergenceDetector detector = new RsiDivergenceDetector();

    @Test
    @DisplayName("lower price low with higher RSI low → bullish divergence")
    void bullishDivergence() {
        List<RsiDivergence> found = detector.detect(CandleFixtures.series("DIV", CandleFixtures.divergence()));

        assertEquals(1, found.size());
        RsiDivergence d = found.get(0);
        assertEquals(Direction.BULLISH, d.type());
        assertEquals(34.7826, d.rsiValue(), 1e-4);
        assertEquals(61.917, d.strength(), 1e-3);
        assertEquals(at(50), d.timestamp());
    }

    @Test
    @DisplayName("mirrored prices → bearish divergence with the same strength")
    void bearishDivergence() {
        List<RsiDivergence> found = detector.detect(
            CandleFixtures.series("DIV", CandleFixtures.mirroredDivergence()));

        assertEquals(1, found.size());
        assertEquals(Direction.BEARISH, found.get(0).type());
        assertEquals(65.2174, found.get(0).rsiValue(), 1e-4);
        assertEquals(61.917, found.get(0).strength(), 1e-3);
    }

    @Test
    @DisplayName("41 candles → empty")
    void belowMinimum() {
        assertTrue(detector.detect(
            CandleFixtures.series("DIV", CandleFixtures.divergence().subList(0, 41))).isEmpty());
    }

    @Test
    @DisplayName("steady trend has no swings to compare")
    void noSwings() {
        assertTrue(detector.detect(CandleFixtures.series("UP", CandleFixtures.uptrend(60))).isEmpty());
    }
}
