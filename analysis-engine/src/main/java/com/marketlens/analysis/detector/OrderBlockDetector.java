package com.marketlens.analysis.detector;

import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.OrderBlock;
import com.marketlens.common.detection.ZoneType;
import com.marketlens.common.indicator.IndicatorSeries;
import com.marketlens.common.indicator.TechnicalIndicators;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags candles whose volume exceeds mean20 + 2σ and whose body is wider than half the
 * average high-low range of the previous 10 candles.
 * Bullish candles become DEMAND blocks, the rest SUPPLY. Strength = min(100, body / range × 50).
 * The last 5 candles are not scanned: a block needs follow-through to be meaningful.
 */
public final class OrderBlockDetector implements PatternDetector<OrderBlock> {

    static final int    MIN_CANDLES         = 50;
    static final int    FIRST_INDEX         = 20;
    static final int    TRAILING_EXCLUDED   = 5;
    static final int    RANGE_LOOKBACK      = 10;
    static final double VOLUME_STD_MULTIPLE = 2.0;
    static final double BODY_TO_RANGE       = 0.5;
    static final double STRENGTH_SCALE      = 50;
    static final double MAX_STRENGTH        = 100;
    static final int    MAX_RESULTS         = 10;

    @Override
    public String detectorName() { return "OrderBlockDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<OrderBlock> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        IndicatorSeries ind = series.indicators();
        double[] highs = series.highs();
        double[] lows  = series.lows();
        List<OrderBlock> found = new ArrayList<>();

        for (int i = FIRST_INDEX; i < series.size() - TRAILING_EXCLUDED; i++) {
            double threshold = ind.volumeMean20(i) + VOLUME_STD_MULTIPLE * ind.volumeStd20(i);
            if (!(series.volume(i) > threshold)) continue;

            double body = Math.abs(series.close(i) - series.open(i));
            double avgRange = TechnicalIndicators.mean(highs, i - RANGE_LOOKBACK, i)
                            - TechnicalIndicators.mean(lows, i - RANGE_LOOKBACK, i);
            if (avgRange <= 0 || body <= avgRange * BODY_TO_RANGE) continue;

            ZoneType type = series.close(i) > series.open(i) ? ZoneType.DEMAND : ZoneType.SUPPLY;
            double strength = Math.min(body / avgRange * STRENGTH_SCALE, MAX_STRENGTH);
            found.add(new OrderBlock(series.close(i), type, strength, series.timestamp(i)));
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }
}
