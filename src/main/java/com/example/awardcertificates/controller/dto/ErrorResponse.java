package com.example.awardcertificates.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

public record ErrorResponse(
        @Schema(description = "Time the error occurred")
        Instant timestamp,
        @Schema(description = "HTTP status code", example = "409")
        int status,
        @Schema(description = "HTTP reason phrase", example = "Conflict")
        String error,
        @Schema(description = "Machine-readable error kind", example = "DEADLINE_PASSED")
        String code,
        @Schema(description = "Human readable message")
        String message,
        @Schema(description = "Certificate fields the error refers to, by wire name")
        List<String> fields,
        @Schema(description = "Request path")
        String path) {
}
