package com.marketlens.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngineConfig.class);

    @Value("${analysis.parallel-detectors:true}")
    private boolean parallelDetectors;

    @Value("${analysis.request-timeout-seconds:10}")
    private long requestTimeoutSeconds;

    /** Instants travel as ISO-8601 strings in both directions. */
    @Bean
    public ObjectMapper objectMapper() {
        log.info("Analysis engine configured. parallelDetectors={} requestTimeout={}s",
            parallelDetectors, requestTimeoutSeconds);
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
