package com.example.awardcertificates.service.reconciliation;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.Role;

import java.util.EnumMap;
import java.util.Map;

/**
 * Students submit their own awards: student number and name come from the
 * account, the advisor has to be entered by hand.
 */
final class StudentAuthorityPolicy implements AuthorityPolicy {

    static final StudentAuthorityPolicy INSTANCE = new StudentAuthorityPolicy();

    private StudentAuthorityPolicy() {
    }

    @Override
    public Role role() {
        return Role.STUDENT;
    }

    @Override
    public Map<CertificateField, String> authoritativeFields(Identity identity) {
        Map<CertificateField, String> fields = new EnumMap<>(CertificateField.class);
        fields.put(CertificateField.STUDENT_ID, identity.accountId());
        fields.put(CertificateField.STUDENT_NAME, identity.displayName());
        return fields;
    }

    @Override
    public Map<CertificateField, String> fallbackFields(Identity identity) {
        if (identity.department() == null || identity.department().isBlank()) {
            return Map.of();
        }
        return Map.of(CertificateField.DEPARTMENT, identity.department());
    }
}
