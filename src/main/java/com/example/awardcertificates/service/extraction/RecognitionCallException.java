package com.example.awardcertificates.service.extraction;

/**
 * Failure of a single call to the recognition capability. Transient failures
 * are retried by {@link ExtractionClient}; the rest surface immediately.
 */
public class RecognitionCallException extends RuntimeException {

    private final boolean transientFailure;

    public RecognitionCallException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public RecognitionCallException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
