package com.example.awardcertificates.exception;

public class ExtractionException extends CertificateException {

    private final String reason;
    private final boolean transientFailure;

    public ExtractionException(String reason, boolean transientFailure) {
        super("Certificate extraction failed: " + reason);
        this.reason = reason;
        this.transientFailure = transientFailure;
    }

    public ExtractionException(String reason, boolean transientFailure, Throwable cause) {
        super("Certificate extraction failed: " + reason, cause);
        this.reason = reason;
        this.transientFailure = transientFailure;
    }

    public String getReason() {
        return reason;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
