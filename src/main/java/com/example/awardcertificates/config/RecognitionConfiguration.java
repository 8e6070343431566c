package com.example.awardcertificates.config;

import com.example.awardcertificates.service.extraction.FixtureVisionRecognitionService;
import com.example.awardcertificates.service.extraction.RecognitionCallException;
import com.example.awardcertificates.service.extraction.RemoteVisionRecognitionService;
import com.example.awardcertificates.service.extraction.VisionRecognitionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the recognition capability. {@code certificates.recognition.mode}
 * selects the remote adapter or the fixture replay.
 */
@Configuration
public class RecognitionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RecognitionConfiguration.class);

    @Bean
    public RestTemplate recognitionRestTemplate(RestTemplateBuilder builder, CertificateProperties properties) {
        CertificateProperties.Recognition recognition = properties.getRecognition();
        return builder
                .setConnectTimeout(recognition.getConnectTimeout())
                .setReadTimeout(recognition.getReadTimeout())
                .build();
    }

    @Bean
    public VisionRecognitionService visionRecognitionService(RestTemplate recognitionRestTemplate,
                                                             ObjectMapper objectMapper,
                                                             CertificateProperties properties) {
        CertificateProperties.Recognition recognition = properties.getRecognition();
        if ("fixture".equalsIgnoreCase(recognition.getMode())) {
            log.info("Using fixture recognition replies. Configure certificates.recognition.mode=remote for real extraction.");
            return new FixtureVisionRecognitionService(recognition.getFixtureResponse());
        }
        log.info("Using remote recognition model {} at {} (read timeout {})", recognition.getModel(),
                recognition.getBaseUrl(), recognition.getReadTimeout());
        return new RemoteVisionRecognitionService(recognitionRestTemplate, objectMapper, recognition);
    }

    @Bean
    public Retry recognitionRetry(CertificateProperties properties) {
        return buildRetry(properties.getRecognition());
    }

    public static Retry buildRetry(CertificateProperties.Recognition recognition) {
        long initialMillis = Math.max(1L, recognition.getInitialBackoff().toMillis());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, recognition.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialMillis,
                        Math.max(1.0, recognition.getBackoffMultiplier())))
                .retryOnException(ex -> ex instanceof RecognitionCallException call && call.isTransientFailure())
                .build();
        Retry retry = Retry.of("recognition", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Recognition attempt {} failed, retrying in {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
        return retry;
    }
}
