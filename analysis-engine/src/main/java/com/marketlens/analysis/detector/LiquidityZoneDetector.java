package com.marketlens.analysis.detector;

import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.LiquidityZone;
import com.marketlens.common.detection.ZoneType;
import com.marketlens.common.indicator.IndicatorSeries;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Candles trading more than 1.5× their 10-period mean volume (window includes the candle)
 * mark a liquidity zone over the candle's [low, high].
 */
public final class LiquidityZoneDetector implements PatternDetector<LiquidityZone> {

    static final int    MIN_CANDLES       = 20;
    static final int    FIRST_INDEX       = IndicatorSeries.VOLUME_SHORT;
    static final double VOLUME_MULTIPLE   = 1.5;
    static final int    MAX_RESULTS       = 5;

    @Override
    public String detectorName() { return "LiquidityZoneDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<LiquidityZone> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        IndicatorSeries ind = series.indicators();
        List<LiquidityZone> found = new ArrayList<>();

        for (int i = FIRST_INDEX; i < series.size(); i++) {
            if (series.volume(i) > ind.volumeMean10(i) * VOLUME_MULTIPLE) {
                ZoneType type = series.candle(i).isBullish() ? ZoneType.DEMAND : ZoneType.SUPPLY;
                found.add(new LiquidityZone(series.high(i), series.low(i), series.volume(i),
                    type, series.timestamp(i)));
            }
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }
}
