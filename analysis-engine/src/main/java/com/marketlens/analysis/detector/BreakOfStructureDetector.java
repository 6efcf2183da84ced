package com.marketlens.analysis.detector;

import com.marketlens.common.detection.BreakOfStructure;
import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.indicator.TechnicalIndicators;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Close beyond the recent swing high / low.
 *
 * <p>Swing levels are the centered rolling-5 max of highs (min of lows). For candle i the
 * reference is the extreme of the swing values at positions [i−10, i−3], the positions whose
 * 5-candle window closes before i. Strength is the overshoot in percent of the level.
 */
public final class BreakOfStructureDetector implements PatternDetector<BreakOfStructure> {

    static final int MIN_CANDLES  = 20;
    static final int SWING_WINDOW = 5;
    static final int LOOKBACK     = 10;
    static final int FIRST_INDEX  = LOOKBACK + SWING_WINDOW / 2;
    static final int MAX_RESULTS  = 3;

    @Override
    public String detectorName() { return "BreakOfStructureDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<BreakOfStructure> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        double[] swingHighs = TechnicalIndicators.centeredMax(series.highs(), SWING_WINDOW);
        double[] swingLows  = TechnicalIndicators.centeredMin(series.lows(), SWING_WINDOW);
        List<BreakOfStructure> found = new ArrayList<>();

        for (int i = FIRST_INDEX; i < series.size(); i++) {
            int from = i - LOOKBACK;
            int to   = i - SWING_WINDOW / 2;
            double close = series.close(i);

            double recentHigh = extreme(swingHighs, from, to, true);
            if (recentHigh > 0 && close > recentHigh) {
                found.add(new BreakOfStructure(recentHigh, Direction.BULLISH,
                    (close - recentHigh) / recentHigh * 100, series.timestamp(i)));
            }

            double recentLow = extreme(swingLows, from, to, false);
            if (recentLow > 0 && close < recentLow) {
                found.add(new BreakOfStructure(recentLow, Direction.BEARISH,
                    (recentLow - close) / recentLow * 100, series.timestamp(i)));
            }
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }

    /** Max (or min) of the defined values in [from, to); NaN when none is defined. */
    private static double extreme(double[] values, int from, int to, boolean max) {
        double best = Double.NaN;
        for (int k = from; k < to; k++) {
            double v = values[k];
            if (Double.isNaN(v)) continue;
            if (Double.isNaN(best) || (max ? v > best : v < best)) best = v;
        }
        return best;
    }
}
