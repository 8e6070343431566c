package com.example.awardcertificates.model;

import java.util.Locale;

public enum CertificateStatus {
    DRAFT,
    SUBMITTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CertificateStatus fromWireName(String value) {
        return CertificateStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
