package com.example.awardcertificates.controller;

import com.example.awardcertificates.controller.dto.ErrorResponse;
import com.example.awardcertificates.exception.ExtractionException;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.ReconciliationException;
import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CertificateField;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(FormatException.class)
    public ResponseEntity<ErrorResponse> handleFormat(FormatException exception, HttpServletRequest request) {
        HttpStatus status = switch (exception.getKind()) {
            case CONVERSION_TOOL_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case FILE_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            default -> HttpStatus.BAD_REQUEST;
        };
        return respond(status, exception.getKind().name(), exception.getMessage(), List.of(), request);
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ErrorResponse> handleExtraction(ExtractionException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "EXTRACTION_FAILED", exception.getMessage(), List.of(), request);
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException exception,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "RECONCILIATION_FAILED", exception.getMessage(),
                exception.getFields(), request);
    }

    @ExceptionHandler(StateException.class)
    public ResponseEntity<ErrorResponse> handleState(StateException exception, HttpServletRequest request) {
        HttpStatus status = switch (exception.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case DEADLINE_PASSED, MISSING_REQUIRED_FIELDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_TRANSITION, RECORD_IMMUTABLE, CONFLICT -> HttpStatus.CONFLICT;
        };
        return respond(status, exception.getKind().name(), exception.getMessage(), exception.getMissingFields(),
                request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException exception,
                                                              HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(exception.getStatusCode().value());
        return respond(status, status.name(), exception.getReason(), List.of(), request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MissingServletRequestPartException.class,
            MethodArgumentNotValidException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", exception.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException exception,
                                                          HttpServletRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, FormatException.Kind.FILE_TOO_LARGE.name(),
                "Uploaded file exceeds the size limit", List.of(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", exception.getMessage(), List.of(), request);
    }

    @ExceptionHandler({IllegalStateException.class, UncheckedIOException.class})
    public ResponseEntity<ErrorResponse> handleInternal(RuntimeException exception, HttpServletRequest request) {
        log.error("Request {} failed", request.getRequestURI(), exception);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", exception.getMessage(), List.of(),
                request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  List<CertificateField> fields, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), code, message,
                fields.stream().map(CertificateField::wireName).toList(), request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
