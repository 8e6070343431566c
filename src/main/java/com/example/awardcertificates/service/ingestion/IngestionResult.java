package com.example.awardcertificates.service.ingestion;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.ExtractionStatus;

import java.util.List;

public record IngestionResult(
        CertificateRecord certificate,
        ExtractionStatus extractionStatus,
        String extractionNotes,
        List<CertificateField> missingRequiredFields) {

    public IngestionResult {
        missingRequiredFields = missingRequiredFields == null ? List.of() : List.copyOf(missingRequiredFields);
    }
}
