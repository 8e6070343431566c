package com.example.awardcertificates.exception;

/**
 * Root of the failures the certificate pipeline reports to its callers.
 */
public abstract class CertificateException extends RuntimeException {

    protected CertificateException(String message) {
        super(message);
    }

    protected CertificateException(String message, Throwable cause) {
        super(message, cause);
    }
}
