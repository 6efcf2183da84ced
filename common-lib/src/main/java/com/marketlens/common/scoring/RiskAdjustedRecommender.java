package com.marketlens.common.scoring;

import com.marketlens.common.model.Action;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.MarketRegime;
import com.marketlens.common.model.RiskAdjustedAction;
import com.marketlens.common.model.VolatilityLevel;

/**
 * Regime-aware adjustment of the base recommendation.
 *
 * <h3>Rule 1 — High external volatility (takes precedence)</h3>
 * <p>BUY → CAUTIOUS_BUY, SELL → STRONG_SELL.
 *
 * <h3>Rule 2 — Confirming regime</h3>
 * <p>BULL_MARKET: BUY → STRONG_BUY. BEAR_MARKET: SELL → STRONG_SELL.
 *
 * <p>HOLD is never adjusted; with no context the base action passes through.
 * This class is stateless, pure, and thread-safe.
 */
public final class RiskAdjustedRecommender {

    private RiskAdjustedRecommender() {}

    public static RiskAdjustedAction adjust(Action base, MarketRegime regime, MarketContext context) {
        if (context == null) {
            return RiskAdjustedAction.from(base);
        }

        if (context.overallVolatility() == VolatilityLevel.HIGH) {
            if (base == Action.BUY)  return RiskAdjustedAction.CAUTIOUS_BUY;
            if (base == Action.SELL) return RiskAdjustedAction.STRONG_SELL;
        } else if (regime == MarketRegime.BULL_MARKET && base == Action.BUY) {
            return RiskAdjustedAction.STRONG_BUY;
        } else if (regime == MarketRegime.BEAR_MARKET && base == Action.SELL) {
            return RiskAdjustedAction.STRONG_SELL;
        }

        return RiskAdjustedAction.from(base);
    }
}
