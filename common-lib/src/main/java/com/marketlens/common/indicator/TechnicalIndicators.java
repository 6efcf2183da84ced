package com.marketlens.common.indicator;

import java.util.Arrays;

/**
 * Pure calculation utilities for rolling technical indicators.
 * Input arrays are oldest-first (index 0 = earliest candle). Every output array is aligned
 * to its input and holds {@code NaN} wherever the window is not yet filled.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * Bias-adjusted EMA: every prior value weighted by (1 − α)^age, normalised by the sum of
     * the weights. Defined from the first element.
     *
     * @param values oldest-first series
     * @param span   EMA span, α = 2 / (span + 1)
     */
    public static double[] ema(double[] values, int span) {
        double[] out = new double[values.length];
        double decay = 1.0 - 2.0 / (span + 1);
        double weightedSum = 0;
        double weightTotal = 0;
        for (int i = 0; i < values.length; i++) {
            weightedSum = values[i] + decay * weightedSum;
            weightTotal = 1 + decay * weightTotal;
            out[i] = weightedSum / weightTotal;
        }
        return out;
    }

    // ── Simple rolling statistics ────────────────────────────────────────────

    /** Rolling mean over the {@code period} values ending at, and including, each index. */
    public static double[] rollingMean(double[] values, int period) {
        double[] out = nanArray(values.length);
        for (int i = period - 1; i < values.length; i++) {
            out[i] = mean(values, i - period + 1, i + 1);
        }
        return out;
    }

    /** Rolling sample standard deviation (n − 1 denominator). */
    public static double[] rollingStd(double[] values, int period) {
        double[] out = nanArray(values.length);
        if (period < 2) return out;
        for (int i = period - 1; i < values.length; i++) {
            double m = mean(values, i - period + 1, i + 1);
            double sq = 0;
            for (int k = i - period + 1; k <= i; k++) {
                double d = values[k] - m;
                sq += d * d;
            }
            out[i] = Math.sqrt(sq / (period - 1));
        }
        return out;
    }

    /** Arithmetic mean of {@code values[from, to)}; NaN for an empty range. */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) return Double.NaN;
        double sum = 0;
        for (int k = from; k < to; k++) sum += values[k];
        return sum / (to - from);
    }

    // ── Volatility ───────────────────────────────────────────────────────────

    /** True range; the first candle has no previous close and uses high − low. */
    public static double[] trueRange(double[] high, double[] low, double[] close) {
        double[] out = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            double range = high[i] - low[i];
            if (i == 0) {
                out[i] = range;
            } else {
                double prev = close[i - 1];
                out[i] = Math.max(range, Math.max(Math.abs(high[i] - prev), Math.abs(low[i] - prev)));
            }
        }
        return out;
    }

    /** Average true range as the simple mean of the last {@code period} true ranges. */
    public static double[] atr(double[] high, double[] low, double[] close, int period) {
        return rollingMean(trueRange(high, low, close), period);
    }

    /** Bollinger band width (upper − lower) / SMA × 100 with ±2σ bands. */
    public static double[] bollingerWidth(double[] close, int period) {
        double[] sma = rollingMean(close, period);
        double[] std = rollingStd(close, period);
        double[] out = nanArray(close.length);
        for (int i = 0; i < close.length; i++) {
            if (Double.isNaN(sma[i]) || sma[i] == 0) continue;
            double upper = sma[i] + std[i] * 2;
            double lower = sma[i] - std[i] * 2;
            out[i] = (upper - lower) / sma[i] * 100;
        }
        return out;
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI from simple means of the gains and losses of the last {@code period} close-to-close
     * changes. Flat windows (no gain, no loss) are undefined.
     *
     * @return RSI 0–100 per index, NaN before index {@code period}
     */
    public static double[] rsi(double[] close, int period) {
        double[] out = nanArray(close.length);
        for (int i = period; i < close.length; i++) {
            double avgGain = 0;
            double avgLoss = 0;
            for (int k = i - period + 1; k <= i; k++) {
                double change = close[k] - close[k - 1];
                if (change > 0) avgGain += change;
                else avgLoss += -change;
            }
            avgGain /= period;
            avgLoss /= period;
            if (avgLoss == 0) {
                out[i] = avgGain > 0 ? 100.0 : Double.NaN;
            } else {
                double rs = avgGain / avgLoss;
                out[i] = 100.0 - (100.0 / (1.0 + rs));
            }
        }
        return out;
    }

    // ── Centered extrema ─────────────────────────────────────────────────────

    /**
     * Max over a window centred on each index. Odd windows span [i − w/2, i + w/2];
     * even windows span [i − w/2, i + w/2 − 1]. NaN when the window leaves the series or
     * contains an undefined value.
     */
    public static double[] centeredMax(double[] values, int window) {
        return centered(values, window, true);
    }

    /** Min counterpart of {@link #centeredMax(double[], int)}. */
    public static double[] centeredMin(double[] values, int window) {
        return centered(values, window, false);
    }

    private static double[] centered(double[] values, int window, boolean max) {
        int before = window / 2;
        int after  = window % 2 == 1 ? window / 2 : window / 2 - 1;
        double[] out = nanArray(values.length);
        for (int i = before; i + after < values.length; i++) {
            double best = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            boolean defined = true;
            for (int k = i - before; k <= i + after; k++) {
                if (Double.isNaN(values[k])) {
                    defined = false;
                    break;
                }
                best = max ? Math.max(best, values[k]) : Math.min(best, values[k]);
            }
            if (defined) out[i] = best;
        }
        return out;
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
