package com.example.awardcertificates.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single recognition call. Absent fields are simply missing
 * from {@link #fields()}; a partial result is still usable by the reconciler.
 */
public record ExtractionResult(ExtractionStatus status, Map<CertificateField, String> fields, String notes) {

    public ExtractionResult {
        Objects.requireNonNull(status, "status");
        EnumMap<CertificateField, String> copy = new EnumMap<>(CertificateField.class);
        if (fields != null) {
            fields.forEach((field, value) -> {
                if (value != null && !value.isBlank()) {
                    copy.put(field, value.trim());
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static ExtractionResult of(Map<CertificateField, String> fields, String notes) {
        ExtractionResult probe = new ExtractionResult(ExtractionStatus.PARTIAL, fields, notes);
        boolean complete = probe.fields().size() == CertificateField.values().length;
        boolean clean = notes == null || notes.isBlank();
        return complete && clean ? new ExtractionResult(ExtractionStatus.OK, probe.fields(), null) : probe;
    }

    public static ExtractionResult failed(String reason) {
        return new ExtractionResult(ExtractionStatus.FAILED, Map.of(), reason);
    }

    public Optional<String> value(CertificateField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean isFailed() {
        return status == ExtractionStatus.FAILED;
    }
}
