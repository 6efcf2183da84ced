package com.marketlens.analysis.controller;

import com.marketlens.analysis.dto.AnalysisRequest;
import com.marketlens.analysis.dto.ErrorResponse;
import com.marketlens.analysis.service.MarketAnalysisService;
import com.marketlens.common.exception.InvalidCandleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final MarketAnalysisService analysisService;
    private final Duration requestTimeout;

    public AnalysisController(MarketAnalysisService analysisService,
                              @Value("${analysis.request-timeout-seconds:10}") long requestTimeoutSeconds) {
        this.analysisService = analysisService;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    }

    @PostMapping
    public Mono<ResponseEntity<Object>> analyze(@RequestBody AnalysisRequest request) {
        return analysisService.analyze(request)
            .timeout(requestTimeout)
            .map(assessment -> ResponseEntity.<Object>ok(assessment))
            .onErrorResume(InvalidCandleException.class, e -> {
                log.warn("Rejected analysis request. symbol={} reason={}", e.getSymbol(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest().<Object>body(new ErrorResponse(e.getMessage())));
            })
            .onErrorResume(e -> {
                log.error("Analysis failed for symbol={}", request.symbol(), e);
                return Mono.just(ResponseEntity.internalServerError()
                    .<Object>body(new ErrorResponse("Analysis failed: " + e.getMessage())));
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
