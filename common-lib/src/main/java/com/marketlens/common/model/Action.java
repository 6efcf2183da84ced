package com.marketlens.common.model;

/**
 * Directional recommendation emitted by the synthesizer.
 */
public enum Action {
    BUY,
    SELL,
    HOLD
}
