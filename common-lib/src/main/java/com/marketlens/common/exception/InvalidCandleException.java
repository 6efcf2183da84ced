package com.marketlens.common.exception;

/**
 * Raised when a candle series breaks the supplier contract (non-monotonic timestamps,
 * non-positive prices, negative volume, inconsistent OHLC). Never raised for short or
 * degenerate-but-valid series; those degrade to empty / unknown output instead.
 */
public class InvalidCandleException extends RuntimeException {
    private final String symbol;

    public InvalidCandleException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public InvalidCandleException(String symbol, int index, String message) {
        this(symbol, "candle[" + index + "] " + message);
    }

    public String getSymbol() {
        return symbol;
    }
}
