package com.marketlens.analysis.detector;

import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.detection.FairValueGap;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Three-candle imbalance: low[i] &gt; high[i−2] is a bullish gap spanning
 * [high[i−2], low[i]]; high[i] &lt; low[i−2] is a bearish gap spanning [high[i], low[i−2]].
 * A candle produces at most one gap, bullish first.
 */
public final class FairValueGapDetector implements PatternDetector<FairValueGap> {

    static final int MIN_CANDLES = 3;
    static final int MAX_RESULTS = 5;

    @Override
    public String detectorName() { return "FairValueGapDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<FairValueGap> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        List<FairValueGap> found = new ArrayList<>();
        for (int i = 2; i < series.size(); i++) {
            if (series.low(i) > series.high(i - 2)) {
                found.add(new FairValueGap(series.low(i), series.high(i - 2),
                    Direction.BULLISH, series.timestamp(i)));
            } else if (series.high(i) < series.low(i - 2)) {
                found.add(new FairValueGap(series.low(i - 2), series.high(i),
                    Direction.BEARISH, series.timestamp(i)));
            }
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }
}
