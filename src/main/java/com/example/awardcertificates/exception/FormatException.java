package com.example.awardcertificates.exception;

public class FormatException extends CertificateException {

    public enum Kind {
        UNSUPPORTED_FORMAT,
        CORRUPT_INPUT,
        PASSWORD_PROTECTED,
        CONVERSION_TOOL_UNAVAILABLE,
        EMPTY_INPUT,
        FILE_TOO_LARGE
    }

    private final Kind kind;

    public FormatException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FormatException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Environment problems need an operator, not a different upload.
     */
    public boolean isEnvironmentError() {
        return kind == Kind.CONVERSION_TOOL_UNAVAILABLE;
    }
}
