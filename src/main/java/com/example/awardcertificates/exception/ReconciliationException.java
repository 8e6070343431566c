package com.example.awardcertificates.exception;

import com.example.awardcertificates.model.CertificateField;

import java.util.List;

public class ReconciliationException extends CertificateException {

    private final List<CertificateField> fields;

    public ReconciliationException(String message, List<CertificateField> fields) {
        super(message);
        this.fields = List.copyOf(fields);
    }

    public List<CertificateField> getFields() {
        return fields;
    }
}
