package com.marketlens.analysis.detector;

import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.detection.RsiDivergence;
import com.marketlens.common.indicator.IndicatorSeries;
import com.marketlens.common.indicator.TechnicalIndicators;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Price / RSI-14 divergence at swing extremes.
 *
 * <p>A swing low is a candle whose low is the centered rolling-5 min of lows and whose RSI is
 * the centered rolling-5 min of RSI (symmetric for swing highs). Each swing is compared with
 * the nearest prior swing of the same kind at least 6 and at most 20 candles back:
 * <ul>
 *   <li>lower low with higher RSI   → BULLISH, strength = 2 × (RSI now − RSI then)</li>
 *   <li>higher high with lower RSI  → BEARISH, strength = 2 × (RSI then − RSI now)</li>
 * </ul>
 * The last 5 candles are not scanned, their swing is not confirmed yet.
 */
public final class RsiDivergenceDetector implements PatternDetector<RsiDivergence> {

    static final int    MIN_CANDLES       = IndicatorSeries.RSI_PERIOD * 3;
    static final int    FIRST_INDEX       = IndicatorSeries.RSI_PERIOD + 10;
    static final int    TRAILING_EXCLUDED = 5;
    static final int    SWING_WINDOW      = 5;
    static final int    LOOKBACK          = 20;
    static final int    MIN_SEPARATION    = 6;
    static final double STRENGTH_SCALE    = 2.0;
    static final int    MAX_RESULTS       = 2;

    @Override
    public String detectorName() { return "RsiDivergenceDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<RsiDivergence> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        double[] lows  = series.lows();
        double[] highs = series.highs();
        double[] rsi   = series.indicators().rsi14Series();
        double[] priceLows  = TechnicalIndicators.centeredMin(lows, SWING_WINDOW);
        double[] priceHighs = TechnicalIndicators.centeredMax(highs, SWING_WINDOW);
        double[] rsiLows    = TechnicalIndicators.centeredMin(rsi, SWING_WINDOW);
        double[] rsiHighs   = TechnicalIndicators.centeredMax(rsi, SWING_WINDOW);

        List<RsiDivergence> found = new ArrayList<>();
        for (int i = FIRST_INDEX; i < series.size() - TRAILING_EXCLUDED; i++) {
            if (isSwing(i, lows, priceLows, rsi, rsiLows)) {
                int j = nearestPriorSwing(i, lows, priceLows, rsi, rsiLows);
                if (j >= 0 && lows[i] < lows[j] && rsi[i] > rsi[j]) {
                    found.add(new RsiDivergence(Direction.BULLISH, rsi[i],
                        (rsi[i] - rsi[j]) * STRENGTH_SCALE, series.timestamp(i)));
                }
            }
            if (isSwing(i, highs, priceHighs, rsi, rsiHighs)) {
                int j = nearestPriorSwing(i, highs, priceHighs, rsi, rsiHighs);
                if (j >= 0 && highs[i] > highs[j] && rsi[i] < rsi[j]) {
                    found.add(new RsiDivergence(Direction.BEARISH, rsi[i],
                        (rsi[j] - rsi[i]) * STRENGTH_SCALE, series.timestamp(i)));
                }
            }
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }

    private static boolean isSwing(int k, double[] price, double[] priceExtreme,
                                   double[] rsi, double[] rsiExtreme) {
        return price[k] == priceExtreme[k] && rsi[k] == rsiExtreme[k];
    }

    private static int nearestPriorSwing(int i, double[] price, double[] priceExtreme,
                                         double[] rsi, double[] rsiExtreme) {
        for (int j = i - MIN_SEPARATION; j >= Math.max(0, i - LOOKBACK); j--) {
            if (isSwing(j, price, priceExtreme, rsi, rsiExtreme)) return j;
        }
        return -1;
    }
}
