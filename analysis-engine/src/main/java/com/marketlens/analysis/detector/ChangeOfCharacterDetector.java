package com.marketlens.analysis.detector;

import com.marketlens.common.detection.ChangeOfCharacter;
import com.marketlens.common.detection.Detections;
import com.marketlens.common.detection.Direction;
import com.marketlens.common.indicator.IndicatorSeries;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * EMA-9 crossing EMA-21 relative to the previous candle. The new side of the cross names the
 * direction; strength is |EMA9 − EMA21| / EMA21 × 100.
 */
public final class ChangeOfCharacterDetector implements PatternDetector<ChangeOfCharacter> {

    static final int MIN_CANDLES = 30;
    static final int FIRST_INDEX = IndicatorSeries.EMA_MEDIUM;
    static final int MAX_RESULTS = 3;

    @Override
    public String detectorName() { return "ChangeOfCharacterDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<ChangeOfCharacter> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        IndicatorSeries ind = series.indicators();
        List<ChangeOfCharacter> found = new ArrayList<>();

        for (int i = FIRST_INDEX; i < series.size(); i++) {
            double fast     = ind.ema9(i);
            double slow     = ind.ema21(i);
            double prevFast = ind.ema9(i - 1);
            double prevSlow = ind.ema21(i - 1);

            Direction flip = null;
            if (fast > slow && prevFast <= prevSlow) {
                flip = Direction.BULLISH;
            } else if (fast < slow && prevFast >= prevSlow) {
                flip = Direction.BEARISH;
            }
            if (flip != null) {
                double strength = Math.abs(fast - slow) / slow * 100;
                found.add(new ChangeOfCharacter(flip, series.close(i), strength, series.timestamp(i)));
            }
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }
}
