package com.bubblegrade.config;

import com.bubblegrade.config.GradingProperties.BackendProperties;
import com.bubblegrade.service.backend.GradingBackend;
import com.bubblegrade.service.backend.LocalGradingBackend;
import com.bubblegrade.service.backend.RemoteGradingBackend;
import com.bubblegrade.service.ocr.FieldExtractor;
import com.bubblegrade.service.ocr.FieldNormalizer;
import com.bubblegrade.service.omr.OmrGrader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the grading backend from {@code bubblegrade.backend.mode}.
 */
@Configuration
public class GradingBackendConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GradingBackendConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "bubblegrade.backend", name = "mode", havingValue = "local", matchIfMissing = true)
    public GradingBackend localGradingBackend(OmrGrader omrGrader, FieldExtractor fieldExtractor) {
        log.info("Grading sheets in process");
        return new LocalGradingBackend(omrGrader, fieldExtractor);
    }

    @Bean
    @ConditionalOnProperty(prefix = "bubblegrade.backend", name = "mode", havingValue = "remote")
    public GradingBackend remoteGradingBackend(GradingProperties properties, WebClient.Builder builder,
            FieldNormalizer normalizer, ObjectMapper objectMapper) {
        BackendProperties backend = properties.backend();
        log.info("Grading sheets through OMR service {} and OCR service {}", backend.omrUrl(), backend.ocrUrl());
        return new RemoteGradingBackend(
                builder.clone().baseUrl(backend.omrUrl()).build(),
                builder.clone().baseUrl(backend.ocrUrl()).build(),
                backend.timeout(),
                normalizer,
                objectMapper);
    }
}
