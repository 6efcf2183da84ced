package com.marketlens.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlens.common.detection.DetectionSet;

/**
 * The sole artifact of one engine invocation: classifier output, every detection list,
 * the synthesized recommendation and its regime-adjusted variant.
 *
 * <p>Pure data, JSON-compatible, created fresh per call and never mutated.
 * {@code comparativeAnalysis} and {@code marketContext} are {@code null} when not requested.
 */
public record IntelligentAssessment(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("market_analysis") MarketAssessment marketAnalysis,
    @JsonProperty("volatility_indicators") VolatilityIndicators volatilityIndicators,
    @JsonProperty("detections") DetectionSet detections,
    @JsonProperty("recommendation") Recommendation recommendation,
    @JsonProperty("comparative_analysis") ComparativeResult comparativeAnalysis,
    @JsonProperty("market_context") MarketContext marketContext,
    @JsonProperty("intelligent_score") double intelligentScore,
    @JsonProperty("regime_analysis") MarketRegime regimeAnalysis,
    @JsonProperty("risk_adjusted_recommendation") RiskAdjustedAction riskAdjustedRecommendation,
    @JsonProperty("metadata") AnalysisMetadata metadata
) {
    public IntelligentAssessment {
        intelligentScore = Scores.clamp(intelligentScore);
    }
}
