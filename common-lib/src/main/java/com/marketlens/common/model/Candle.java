package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One OHLCV observation for a fixed time bucket.
 */
public record Candle(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") double volume
) {
    public static Candle of(Instant timestamp, double open, double high,
                            double low, double close, double volume) {
        return new Candle(timestamp, open, high, low, close, volume);
    }

    @JsonIgnore
    public boolean isBullish() {
        return close > open;
    }

    /** Typical price used by volume-weighted averages: (high + low + close) / 3. */
    public double typicalPrice() {
        return (high + low + close) / 3;
    }
}
