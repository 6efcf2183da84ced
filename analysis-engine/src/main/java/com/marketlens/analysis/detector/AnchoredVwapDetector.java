package com.marketlens.analysis.detector;

import com.marketlens.common.detection.AnchorType;
import com.marketlens.common.detection.AnchoredVwap;
import com.marketlens.common.detection.Detections;
import com.marketlens.common.indicator.TechnicalIndicators;
import com.marketlens.common.model.Candle;
import com.marketlens.common.model.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * VWAP anchored at the last three local extremes.
 *
 * <p>A candle in [10, n−10) is an anchor when its high equals the centered rolling-10 max
 * (HIGH anchor), otherwise when its low equals the centered rolling-10 min (LOW anchor).
 * From each anchor through the last candle, VWAP = Σ(typical price × volume) / Σ volume.
 * Anchors with no traded volume after them are skipped.
 */
public final class AnchoredVwapDetector implements PatternDetector<AnchoredVwap> {

    static final int MIN_CANDLES   = 50;
    static final int ANCHOR_WINDOW = 10;
    static final int EDGE_MARGIN   = 10;
    static final int MAX_RESULTS   = 3;

    @Override
    public String detectorName() { return "AnchoredVwapDetector"; }

    @Override
    public int maxResults() { return MAX_RESULTS; }

    @Override
    public List<AnchoredVwap> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }
        double[] rollingHighs = TechnicalIndicators.centeredMax(series.highs(), ANCHOR_WINDOW);
        double[] rollingLows  = TechnicalIndicators.centeredMin(series.lows(), ANCHOR_WINDOW);

        List<Integer> anchors = new ArrayList<>();
        List<AnchorType> anchorTypes = new ArrayList<>();
        for (int i = EDGE_MARGIN; i < series.size() - EDGE_MARGIN; i++) {
            if (series.high(i) == rollingHighs[i]) {
                anchors.add(i);
                anchorTypes.add(AnchorType.HIGH);
            } else if (series.low(i) == rollingLows[i]) {
                anchors.add(i);
                anchorTypes.add(AnchorType.LOW);
            }
        }

        List<AnchoredVwap> found = new ArrayList<>();
        for (int a = Math.max(0, anchors.size() - MAX_RESULTS); a < anchors.size(); a++) {
            int anchor = anchors.get(a);
            AnchorType type = anchorTypes.get(a);

            double priceVolume = 0;
            double volume = 0;
            for (int i = anchor; i < series.size(); i++) {
                Candle c = series.candle(i);
                priceVolume += c.typicalPrice() * c.volume();
                volume += c.volume();
            }
            if (volume <= 0) continue;

            double anchorPrice = type == AnchorType.HIGH ? series.high(anchor) : series.low(anchor);
            found.add(new AnchoredVwap(anchorPrice, priceVolume / volume, type, series.timestamp(anchor)));
        }
        return Detections.keepMostRecent(found, MAX_RESULTS);
    }
}
