package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final directional signal. {@code targetPrice} and {@code stopLoss} are always
 * {@code null} for {@link Action#HOLD}.
 */
public record Recommendation(
    @JsonProperty("action") Action action,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("target_price") Double targetPrice,
    @JsonProperty("stop_loss") Double stopLoss
) {
    public Recommendation {
        confidence = Scores.clamp(confidence);
        if (action == Action.HOLD) {
            targetPrice = null;
            stopLoss    = null;
        }
    }

    public static Recommendation hold(double confidence, String reasoning) {
        return new Recommendation(Action.HOLD, confidence, reasoning, null, null);
    }
}
