package com.marketlens.common.detection;

import java.time.Instant;

/**
 * Common shape of every structural-pattern detection: a pure value stamped with the
 * timestamp of the candle that triggered it.
 */
public interface Detection {
    Instant timestamp();
}
