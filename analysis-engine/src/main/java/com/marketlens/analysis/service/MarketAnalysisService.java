package com.marketlens.analysis.service;

import com.marketlens.analysis.dto.AnalysisRequest;
import com.marketlens.analysis.dto.SeriesPayload;
import com.marketlens.common.classifier.MarketRegimeClassifier;
import com.marketlens.common.classifier.TrendVolatilityClassifier;
import com.marketlens.common.comparative.ComparativeAnalyzer;
import com.marketlens.common.context.MarketContextAggregator;
import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.model.AnalysisMetadata;
import com.marketlens.common.model.CandleSeries;
import com.marketlens.common.model.ComparativeResult;
import com.marketlens.common.model.IntelligentAssessment;
import com.marketlens.common.model.MarketAssessment;
import com.marketlens.common.model.MarketContext;
import com.marketlens.common.model.MarketRegime;
import com.marketlens.common.model.Recommendation;
import com.marketlens.common.model.RiskAdjustedAction;
import com.marketlens.common.model.VolatilityIndicators;
import com.marketlens.common.recommendation.RecommendationSynthesizer;
import com.marketlens.common.scoring.IntelligentScoreCalculator;
import com.marketlens.common.scoring.RiskAdjustedRecommender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point of the engine: candles in, one {@link IntelligentAssessment} out.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Validate and wrap every candle list ({@code InvalidCandleException} fails fast).</li>
 *   <li>Classifier + detectors via {@link DetectorDispatchService}, zipped with the optional
 *       comparative analysis.</li>
 *   <li>Recommendation, intelligent score, regime and regime-adjusted action.</li>
 * </ol>
 * Deterministic: the same input always yields the same assessment.
 */
@Service
public class MarketAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(MarketAnalysisService.class);

    static final String DEFAULT_TIMEFRAME = "1h";

    private final DetectorDispatchService dispatchService;

    public MarketAnalysisService(DetectorDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    public Mono<IntelligentAssessment> analyze(AnalysisRequest request) {
        return Mono.defer(() -> {
            String timeframe = request.timeframe() == null ? DEFAULT_TIMEFRAME : request.timeframe();
            CandleSeries primary = CandleSeries.of(request.symbol(), timeframe, request.candles());
            CandleSeries companion = request.comparison() == null ? null
                : CandleSeries.of(request.comparison().symbol(), timeframe, request.comparison().candles());
            MarketContext context = resolveContext(request, timeframe);
            return analyze(primary, companion, context);
        });
    }

    /**
     * @param series    primary instrument
     * @param companion optional comparison instrument ({@code null} = no comparative block)
     * @param context   optional market snapshot ({@code null} = regime {@code unknown})
     */
    public Mono<IntelligentAssessment> analyze(CandleSeries series, CandleSeries companion,
                                               MarketContext context) {
        log.info("Analysis started. symbol={} timeframe={} candles={} comparison={} context={}",
            series.symbol(), series.timeframe(), series.size(),
            companion == null ? "none" : companion.symbol(), context != null);

        Mono<Optional<ComparativeResult>> comparative = companion == null
            ? Mono.just(Optional.empty())
            : Mono.fromCallable(() -> Optional.of(ComparativeAnalyzer.compare(series, companion)));

        return Mono.zip(dispatchService.dispatchAll(series), comparative)
            .map(t -> assemble(series, t.getT1(), t.getT2().orElse(null), context))
            .doOnSuccess(a -> log.info(
                "Analysis complete. symbol={} trend={} action={} score={} regime={} adjusted={}",
                a.symbol(), a.marketAnalysis().trend(), a.recommendation().action(),
                a.intelligentScore(), a.regimeAnalysis(),
                a.riskAdjustedRecommendation()));
    }

    private IntelligentAssessment assemble(CandleSeries series, StructureSnapshot snapshot,
                                           ComparativeResult comparative, MarketContext context) {
        MarketAssessment assessment = snapshot.assessment();
        DetectionSet detections = snapshot.detections();

        // ── synthesis ────────────────────────────────────────────────────────
        Recommendation recommendation = RecommendationSynthesizer.synthesize(series, assessment, detections);
        VolatilityIndicators volatility =
            TrendVolatilityClassifier.volatilityIndicators(series, assessment.volatility());

        // ── scoring / regime ─────────────────────────────────────────────────
        double score = IntelligentScoreCalculator.compute(assessment, detections, recommendation, context);
        MarketRegime regime = MarketRegimeClassifier.classify(context);
        RiskAdjustedAction adjusted = RiskAdjustedRecommender.adjust(recommendation.action(), regime, context);

        AnalysisMetadata metadata =
            new AnalysisMetadata(series.size(), series.lastClose(), series.last().timestamp());

        return new IntelligentAssessment(series.symbol(), series.timeframe(), assessment, volatility,
            detections, recommendation, comparative, context, score, regime, adjusted, metadata);
    }

    private MarketContext resolveContext(AnalysisRequest request, String timeframe) {
        if (request.marketContext() != null) {
            return request.marketContext();
        }
        List<SeriesPayload> benchmarks = request.benchmarks();
        if (benchmarks == null || benchmarks.isEmpty()) {
            return null;
        }
        List<MarketAssessment> assessments = benchmarks.stream()
            .map(b -> TrendVolatilityClassifier.assess(CandleSeries.of(b.symbol(), timeframe, b.candles())))
            .toList();
        MarketContext context = MarketContextAggregator.aggregate(assessments);
        log.debug("Market context aggregated from {} benchmarks. sentiment={} benchmarkTrend={} volatility={}",
            assessments.size(), context.marketSentiment(), context.benchmarkTrend(), context.overallVolatility());
        return context;
    }
}
