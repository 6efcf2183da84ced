package com.marketlens.common.indicator;

/**
 * Derived rolling series of one candle window, computed once and read concurrently by the
 * classifier and every detector. Backing arrays never leave this class; readers get single
 * values by index. Undefined positions read as {@code NaN}.
 */
public final class IndicatorSeries {

    public static final int EMA_FAST      = 9;
    public static final int EMA_MEDIUM    = 21;
    public static final int EMA_SLOW      = 50;
    public static final int ATR_PERIOD    = 14;
    public static final int RSI_PERIOD    = 14;
    public static final int BB_PERIOD     = 20;
    public static final int VOLUME_LONG   = 20;
    public static final int VOLUME_SHORT  = 10;

    private final double[] ema9;
    private final double[] ema21;
    private final double[] ema50;
    private final double[] atr14;
    private final double[] bollingerWidth20;
    private final double[] rsi14;
    private final double[] volumeMean20;
    private final double[] volumeStd20;
    private final double[] volumeMean10;

    private IndicatorSeries(double[] high, double[] low, double[] close, double[] volume) {
        this.ema9             = TechnicalIndicators.ema(close, EMA_FAST);
        this.ema21            = TechnicalIndicators.ema(close, EMA_MEDIUM);
        this.ema50            = TechnicalIndicators.ema(close, EMA_SLOW);
        this.atr14            = TechnicalIndicators.atr(high, low, close, ATR_PERIOD);
        this.bollingerWidth20 = TechnicalIndicators.bollingerWidth(close, BB_PERIOD);
        this.rsi14            = TechnicalIndicators.rsi(close, RSI_PERIOD);
        this.volumeMean20     = TechnicalIndicators.rollingMean(volume, VOLUME_LONG);
        this.volumeStd20      = TechnicalIndicators.rollingStd(volume, VOLUME_LONG);
        this.volumeMean10     = TechnicalIndicators.rollingMean(volume, VOLUME_SHORT);
    }

    public static IndicatorSeries compute(double[] high, double[] low, double[] close, double[] volume) {
        return new IndicatorSeries(high, low, close, volume);
    }

    public double ema9(int i)             { return ema9[i]; }
    public double ema21(int i)            { return ema21[i]; }
    public double ema50(int i)            { return ema50[i]; }
    public double atr14(int i)            { return atr14[i]; }
    public double bollingerWidth20(int i) { return bollingerWidth20[i]; }
    public double rsi14(int i)            { return rsi14[i]; }
    public double volumeMean20(int i)     { return volumeMean20[i]; }
    public double volumeStd20(int i)      { return volumeStd20[i]; }
    public double volumeMean10(int i)     { return volumeMean10[i]; }

    /** Copy of the full RSI-14 series, for detectors that need rolling extrema over it. */
    public double[] rsi14Series() {
        return rsi14.clone();
    }
}
