package com.marketlens.common;

import com.marketlens.common.model.Candle;
import com.marketlens.common.model.CandleSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Deterministic hourly candle windows shared by the common-lib tests. */
public final class CandleFixtures {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private CandleFixtures() {}

    public static Instant at(int i) {
        return START.plus(Duration.ofHours(i));
    }

    /** close = 100 + i, small bullish bodies, constant volume. */
    public static List<Candle> uptrend(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double close = 100 + i;
            out.add(Candle.of(at(i), close - 0.5, close + 0.3, close - 0.8, close, 1000));
        }
        return out;
    }

    /** close = 200 − i, the mirror of {@link #uptrend(int)}. */
    public static List<Candle> downtrend(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double close = 200 - i;
            out.add(Candle.of(at(i), close + 0.5, close + 0.8, close - 0.3, close, 1000));
        }
        return out;
    }

    /** Tight five-candle oscillation around 100.04 with gently varying volume. */
    public static List<Candle> flat(int n) {
        double[] pattern = {100.00, 100.06, 100.02, 100.08, 100.04};
        List<Candle> out = new ArrayList<>();
        double previous = 100.04;
        for (int i = 0; i < n; i++) {
            double close = pattern[i % pattern.length];
            double open = previous;
            out.add(Candle.of(at(i), open, Math.max(open, close) + 0.01,
                Math.min(open, close) - 0.01, close, 1000 + (i % 3) * 10));
            previous = close;
        }
        return out;
    }

    /** Constant price with a symmetric high-low range of {@code range} around 100. */
    public static List<Candle> ranging(int n, double range) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Candle.of(at(i), 100, 100 + range / 2, 100 - range / 2, 100, 1000));
        }
        return out;
    }

    public static CandleSeries series(String symbol, List<Candle> candles) {
        return CandleSeries.of(symbol, "1h", candles);
    }
}
