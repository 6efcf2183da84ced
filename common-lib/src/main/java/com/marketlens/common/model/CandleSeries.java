package com.marketlens.common.model;

import com.marketlens.common.exception.InvalidCandleException;
import com.marketlens.common.indicator.IndicatorSeries;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, validated, oldest-first candle window for one symbol / timeframe, together
 * with its derived {@link IndicatorSeries}.
 *
 * <p>Construction fails fast with {@link InvalidCandleException} on any upstream contract
 * violation: empty window, non-finite or non-positive price, negative volume, OHLC values
 * that contradict each other, or timestamps that are not strictly ascending.
 * Short windows are valid; consumers degrade on them instead.
 *
 * <p>Safe to share across threads: no field is mutated after construction and raw arrays
 * are only handed out as copies.
 */
public final class CandleSeries {

    private final String symbol;
    private final String timeframe;
    private final List<Candle> candles;
    private final double[] open;
    private final double[] high;
    private final double[] low;
    private final double[] close;
    private final double[] volume;
    private final IndicatorSeries indicators;

    private CandleSeries(String symbol, String timeframe, List<Candle> candles) {
        this.symbol    = symbol;
        this.timeframe = timeframe;
        this.candles   = List.copyOf(candles);
        int n = this.candles.size();
        this.open   = new double[n];
        this.high   = new double[n];
        this.low    = new double[n];
        this.close  = new double[n];
        this.volume = new double[n];
        for (int i = 0; i < n; i++) {
            Candle c = this.candles.get(i);
            open[i]   = c.open();
            high[i]   = c.high();
            low[i]    = c.low();
            close[i]  = c.close();
            volume[i] = c.volume();
        }
        this.indicators = IndicatorSeries.compute(high, low, close, volume);
    }

    /**
     * Validates and wraps the candles.
     *
     * @throws InvalidCandleException if the window violates the candle contract
     */
    public static CandleSeries of(String symbol, String timeframe, List<Candle> candles) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidCandleException("?", "symbol is required");
        }
        if (candles == null || candles.isEmpty()) {
            throw new InvalidCandleException(symbol, "candle series is empty");
        }
        Instant previous = null;
        for (int i = 0; i < candles.size(); i++) {
            Candle c = candles.get(i);
            if (c == null) {
                throw new InvalidCandleException(symbol, i, "is null");
            }
            validate(symbol, i, c);
            if (previous != null && !c.timestamp().isAfter(previous)) {
                throw new InvalidCandleException(symbol, i,
                    "timestamp " + c.timestamp() + " is not after previous " + previous);
            }
            previous = c.timestamp();
        }
        return new CandleSeries(symbol, timeframe, candles);
    }

    private static void validate(String symbol, int i, Candle c) {
        if (c.timestamp() == null) {
            throw new InvalidCandleException(symbol, i, "has no timestamp");
        }
        checkPrice(symbol, i, "open", c.open());
        checkPrice(symbol, i, "high", c.high());
        checkPrice(symbol, i, "low", c.low());
        checkPrice(symbol, i, "close", c.close());
        if (!Double.isFinite(c.volume()) || c.volume() < 0) {
            throw new InvalidCandleException(symbol, i, "volume must be finite and >= 0, got " + c.volume());
        }
        if (c.high() < Math.max(c.open(), c.close()) || c.low() > Math.min(c.open(), c.close())) {
            throw new InvalidCandleException(symbol, i, String.format(
                "inconsistent OHLC open=%s high=%s low=%s close=%s", c.open(), c.high(), c.low(), c.close()));
        }
    }

    private static void checkPrice(String symbol, int i, String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidCandleException(symbol, i, field + " must be finite and > 0, got " + value);
        }
    }

    public String symbol()    { return symbol; }
    public String timeframe() { return timeframe; }
    public int size()         { return candles.size(); }

    /** Unmodifiable oldest-first view. */
    public List<Candle> candles() { return candles; }

    public Candle candle(int i)      { return candles.get(i); }
    public Candle last()             { return candles.get(candles.size() - 1); }
    public Instant timestamp(int i)  { return candles.get(i).timestamp(); }

    public double open(int i)   { return open[i]; }
    public double high(int i)   { return high[i]; }
    public double low(int i)    { return low[i]; }
    public double close(int i)  { return close[i]; }
    public double volume(int i) { return volume[i]; }
    public double lastClose()   { return close[close.length - 1]; }
    public int lastIndex()      { return candles.size() - 1; }

    public double[] highs()  { return high.clone(); }
    public double[] lows()   { return low.clone(); }
    public double[] closes() { return close.clone(); }

    public IndicatorSeries indicators() { return indicators; }
}
