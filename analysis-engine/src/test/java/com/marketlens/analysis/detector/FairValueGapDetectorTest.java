package com.marketlens.analysis.detector;

import com.marketlens.analysis.CandleFixtures;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.detection.FairValueGap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.marketlens.analysis.CandleFixtures.at;
import static org.junit.jupiter.api.Assertions.*;

class FairValueGapDetectorTest {

    private static final double EPS = 1e-9;
    private final FairValueGapDetector detector = new FairValueGapDetector();

    @Test
    @DisplayName("uptrend: every candle gaps over the high two bars back, five most recent kept")
    void bullishGaps() {
        List<FairValueGap> gaps = detector.detect(CandleFixtures.series("UP", CandleFixtures.uptrend(60)));

        assertEquals(FairValueGapDetector.MAX_RESULTS, gaps.size());
        assertEquals(at(55), gaps.get(0).timestamp());
        FairValueGap last = gaps.get(4);
        assertEquals(Direction.BULLISH, last.type());
        assertEquals(158.2, last.upperLevel(), EPS);
        assertEquals(157.3, last.lowerLevel(), EPS);
        assertEquals(at(59), last.timestamp());
    }

    @Test
    @DisplayName("downtrend: bearish gaps between high[i] and low[i−2]")
    void bearishGaps() {
        List<FairValueGap> gaps = detector.detect(CandleFixtures.series("DOWN", CandleFixtures.downtrend(60)));

        FairValueGap last = gaps.get(gaps.size() - 1);
        assertEquals(Direction.BEARISH, last.type());
        assertEquals(142.7, last.upperLevel(), EPS);
        assertEquals(141.8, last.lowerLevel(), EPS);
    }

    @Test
    @DisplayName("upper level is always above lower level")
    void orderedLevels() {
        for (FairValueGap g : detector.detect(CandleFixtures.series("DOWN", CandleFixtures.downtrend(60)))) {
            assertTrue(g.upperLevel() > g.lowerLevel());
        }
    }

    @Test
    @DisplayName("exactly three candles is enough")
    void threeCandles() {
        assertEquals(1, detector.detect(CandleFixtures.series("UP", CandleFixtures.uptrend(3))).size());
    }

    @Test
    @DisplayName("two candles → empty")
    void twoCandles() {
        assertTrue(detector.detect(CandleFixtures.series("UP", CandleFixtures.uptrend(2))).isEmpty());
    }

    @Test
    @DisplayName("overlapping ranges → no gap")
    void flatHasNoGap() {
        assertTrue(detector.detect(CandleFixtures.series("FLAT", CandleFixtures.flat(60))).isEmpty());
    }
}
