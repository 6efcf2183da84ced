package com.marketlens.analysis.service;

import com.marketlens.analysis.detector.PatternDetector;
import com.marketlens.analysis.detector.PatternDetectors;
import com.marketlens.common.classifier.TrendVolatilityClassifier;
import com.marketlens.common.detection.Detection;
import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.model.CandleSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the trend/volatility classifier and the seven pattern detectors over one series.
 *
 * <p>The eight tasks only read the immutable {@link CandleSeries}, so they fan out on the
 * bounded-elastic scheduler and are joined with {@link Mono#zip}. With
 * {@code analysis.parallel-detectors=false} they run sequentially on the subscribing thread;
 * both modes yield identical output.
 */
@Service
public class DetectorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(DetectorDispatchService.class);
    private final Scheduler scheduler;

    public DetectorDispatchService(@Value("${analysis.parallel-detectors:true}") boolean parallelDetectors) {
        this.scheduler = parallelDetectors ? Schedulers.boundedElastic() : Schedulers.immediate();
    }

    public Mono<StructureSnapshot> dispatchAll(CandleSeries series) {
        log.info("Dispatching classifier + {} detectors for symbol={} candles={}",
            PatternDetectors.all().size(), series.symbol(), series.size());
        return Mono.zip(
                task("TrendVolatilityClassifier", series, () -> TrendVolatilityClassifier.assess(series)),
                run(PatternDetectors.ORDER_BLOCKS, series),
                run(PatternDetectors.FAIR_VALUE_GAPS, series),
                run(PatternDetectors.BREAK_OF_STRUCTURE, series),
                run(PatternDetectors.CHANGE_OF_CHARACTER, series),
                run(PatternDetectors.LIQUIDITY_ZONES, series),
                run(PatternDetectors.ANCHORED_VWAP, series),
                run(PatternDetectors.RSI_DIVERGENCE, series))
            .map(t -> new StructureSnapshot(t.getT1(), new DetectionSet(
                t.getT2(), t.getT3(), t.getT4(), t.getT5(), t.getT6(), t.getT7(), t.getT8())));
    }

    private <T extends Detection> Mono<List<T>> run(PatternDetector<T> detector, CandleSeries series) {
        return task(detector.detectorName(), series, () -> detector.detect(series))
            .doOnSuccess(found -> log.debug("Detector={} complete. symbol={} detections={}",
                detector.detectorName(), series.symbol(), found.size()));
    }

    private <R> Mono<R> task(String name, CandleSeries series, Callable<R> work) {
        return Mono.fromCallable(work)
            .subscribeOn(scheduler)
            .doOnError(e -> log.error("Task={} failed for symbol={}", name, series.symbol(), e));
    }
}
