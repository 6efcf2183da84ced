package com.marketlens.common.comparative;

import com.marketlens.common.classifier.TrendVolatilityClassifier;
import com.marketlens.common.model.CandleSeries;
import com.marketlens.common.model.ComparativeResult;
import com.marketlens.common.model.RelativeStrength;
import com.marketlens.common.model.Trend;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a primary series against a companion series of the same timeframe.
 *
 * <ul>
 *   <li>correlation — Pearson correlation of closes aligned on identical timestamps;
 *       0.0 with fewer than two aligned points, zero variance, or a non-finite result</li>
 *   <li>relative strength — OUTPERFORMING when only the primary trend is bullish,
 *       UNDERPERFORMING when only the companion trend is bullish, else NEUTRAL</li>
 *   <li>trend alignment — both trend labels are equal</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public final class ComparativeAnalyzer {

    private ComparativeAnalyzer() {}

    public static ComparativeResult compare(CandleSeries primary, CandleSeries companion) {
        double correlation = correlation(primary, companion);

        Trend primaryTrend   = TrendVolatilityClassifier.trend(primary);
        Trend companionTrend = TrendVolatilityClassifier.trend(companion);

        return new ComparativeResult(
            companion.symbol(),
            correlation,
            relativeStrength(primaryTrend, companionTrend),
            primaryTrend == companionTrend);
    }

    static RelativeStrength relativeStrength(Trend primary, Trend companion) {
        boolean primaryBullish   = primary == Trend.BULLISH;
        boolean companionBullish = companion == Trend.BULLISH;
        if (primaryBullish && !companionBullish) return RelativeStrength.OUTPERFORMING;
        if (!primaryBullish && companionBullish) return RelativeStrength.UNDERPERFORMING;
        return RelativeStrength.NEUTRAL;
    }

    /** Pearson correlation of closes on the timestamps both series share. */
    public static double correlation(CandleSeries primary, CandleSeries companion) {
        Map<Instant, Double> companionCloses = new HashMap<>();
        for (int i = 0; i < companion.size(); i++) {
            companionCloses.put(companion.timestamp(i), companion.close(i));
        }
        List<double[]> pairs = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            Double other = companionCloses.get(primary.timestamp(i));
            if (other != null) {
                pairs.add(new double[]{primary.close(i), other});
            }
        }
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return pearson(x, y);
    }

    /** Pearson correlation clamped to [−1, 1]; 0.0 on any numerical failure. */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) return 0.0;

        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double cov = 0;
        double varX = 0;
        double varY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            cov  += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) return 0.0;

        double r = cov / Math.sqrt(varX * varY);
        if (!Double.isFinite(r)) return 0.0;
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
