package com.example.awardcertificates.controller.dto;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CertificateResponse(
        @Schema(description = "Certificate identifier", example = "42")
        Long certId,
        @Schema(description = "Account that uploaded the certificate", example = "2024010101001")
        String submitterAccountId,
        @Schema(description = "Role of the submitting account", example = "student")
        String submitterRole,
        @Schema(description = "Lifecycle state", allowableValues = {"draft", "submitted"})
        String status,
        @Schema(description = "Certificate fields keyed by wire name; empty fields are null")
        Map<String, String> fields,
        @Schema(description = "Fields confirmed or typed by the submitter")
        List<String> manualFields,
        @Schema(description = "Required fields that must be filled in before submitting")
        List<String> missingRequiredFields,
        @Schema(description = "Identifier of the stored upload", example = "17")
        Long fileId,
        @Schema(description = "Recognition model that produced the extracted values", example = "glm-4v-plus-0111")
        String extractionMethod,
        @Schema(description = "Creation time of the draft")
        LocalDateTime createdAt,
        @Schema(description = "Time of submission, null while the certificate is a draft")
        LocalDateTime submittedAt) {

    public static CertificateResponse from(CertificateRecord record, List<CertificateField> missingRequired) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (CertificateField field : CertificateField.values()) {
            fields.put(field.wireName(), record.get(field));
        }
        return new CertificateResponse(
                record.certId(),
                record.submitterAccountId(),
                record.submitterRole() == null ? null : record.submitterRole().wireName(),
                record.status().wireName(),
                fields,
                record.manualFields().stream().sorted().map(CertificateField::wireName).toList(),
                missingRequired.stream().map(CertificateField::wireName).toList(),
                record.fileId(),
                record.extractionMethod(),
                record.createdAt(),
                record.submittedAt());
    }
}
