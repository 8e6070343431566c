package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.model.CanonicalImage;
import com.example.awardcertificates.model.ExtractionResult;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Sends the canonical image and the fixed schema to the recognition
 * capability. Transient failures are retried within the configured bound;
 * the caller only ever sees a validated {@link ExtractionResult}.
 */
@Service
public class ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(ExtractionClient.class);

    private final VisionRecognitionService recognitionService;
    private final ExtractionResponseParser parser;
    private final Retry retry;

    public ExtractionClient(VisionRecognitionService recognitionService,
                            ExtractionResponseParser parser,
                            Retry recognitionRetry) {
        this.recognitionService = recognitionService;
        this.parser = parser;
        this.retry = recognitionRetry;
    }

    public ExtractionResult extract(CanonicalImage image) {
        Supplier<String> call = Retry.decorateSupplier(retry,
                () -> recognitionService.recognize(image, ExtractionSchema.prompt()));
        long start = System.nanoTime();
        String reply;
        try {
            reply = call.get();
        } catch (RecognitionCallException ex) {
            log.warn("Extraction failed for {} ({}): {}", image,
                    ex.isTransientFailure() ? "retries exhausted" : "not retryable", ex.getMessage());
            return ExtractionResult.failed(ex.getMessage());
        }
        ExtractionResult result = parser.parse(reply);
        log.debug("Extraction finished with status {} and {} fields in {} ms", result.status(),
                result.fields().size(), (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    public String extractionMethod() {
        return recognitionService.modelName();
    }
}
