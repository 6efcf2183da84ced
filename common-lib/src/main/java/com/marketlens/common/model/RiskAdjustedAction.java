package com.marketlens.common.model;

/**
 * Recommendation variant after regime and external-volatility adjustment.
 *
 * <ul>
 *   <li>CAUTIOUS_BUY — BUY issued into high external volatility</li>
 *   <li>STRONG_BUY   — BUY confirmed by a bull-market regime</li>
 *   <li>STRONG_SELL  — SELL under high volatility or a bear-market regime</li>
 * </ul>
 */
public enum RiskAdjustedAction {
    BUY,
    SELL,
    HOLD,
    CAUTIOUS_BUY,
    STRONG_BUY,
    STRONG_SELL;

    /** Unadjusted mapping of a base action. */
    public static RiskAdjustedAction from(Action action) {
        return switch (action) {
            case BUY  -> BUY;
            case SELL -> SELL;
            case HOLD -> HOLD;
        };
    }
}
