package com.example.awardcertificates.controller.dto;

import com.example.awardcertificates.service.ingestion.IngestionResult;
import io.swagger.v3.oas.annotations.media.Schema;

public record IngestionResponse(
        @Schema(description = "The created or refreshed draft")
        CertificateResponse certificate,
        @Schema(description = "Outcome of automatic extraction", allowableValues = {"OK", "PARTIAL"})
        String extractionStatus,
        @Schema(description = "Diagnostics from extraction, such as values that could not be read")
        String extractionNotes) {

    public static IngestionResponse from(IngestionResult result) {
        return new IngestionResponse(
                CertificateResponse.from(result.certificate(), result.missingRequiredFields()),
                result.extractionStatus().name(),
                result.extractionNotes());
    }
}
