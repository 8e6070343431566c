package com.example.awardcertificates.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field values the submitter explicitly typed in. A blank value clears the
 * field. Fields not present here are left untouched.
 */
public final class FieldChanges {

    private static final FieldChanges NONE = new FieldChanges(Map.of());

    private final Map<CertificateField, String> values;

    private FieldChanges(Map<CertificateField, String> values) {
        EnumMap<CertificateField, String> copy = new EnumMap<>(CertificateField.class);
        values.forEach((field, value) -> copy.put(field, value == null ? "" : value.trim()));
        this.values = Collections.unmodifiableMap(copy);
    }

    public static FieldChanges none() {
        return NONE;
    }

    public static FieldChanges of(Map<CertificateField, String> values) {
        return values == null || values.isEmpty() ? NONE : new FieldChanges(values);
    }

    /**
     * Builds changes from wire names such as {@code competition_name}.
     *
     * @throws IllegalArgumentException for names outside the certificate schema
     */
    public static FieldChanges fromWire(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        EnumMap<CertificateField, String> mapped = new EnumMap<>(CertificateField.class);
        values.forEach((name, value) -> {
            CertificateField field = CertificateField.fromWireName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown certificate field: " + name));
            mapped.put(field, value);
        });
        return new FieldChanges(mapped);
    }

    public Set<CertificateField> fields() {
        return values.keySet();
    }

    public Optional<String> value(CertificateField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean targets(CertificateField field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<CertificateField, String> asMap() {
        return values;
    }
}
