package com.example.awardcertificates.service.reconciliation;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.Role;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides, for one submitter role, which certificate fields come from the
 * submitter's account and which must be present before submission.
 */
public interface AuthorityPolicy {

    Set<CertificateField> DEFAULT_REQUIRED = EnumSet.of(
            CertificateField.STUDENT_ID, CertificateField.STUDENT_NAME, CertificateField.ADVISOR);

    Role role();

    /**
     * Values taken from the account. They override extraction and cannot be
     * edited by the submitter.
     */
    Map<CertificateField, String> authoritativeFields(Identity identity);

    /**
     * Values used only when neither extraction nor the submitter supplied one.
     */
    default Map<CertificateField, String> fallbackFields(Identity identity) {
        return Map.of();
    }

    default Set<CertificateField> requiredFields() {
        return DEFAULT_REQUIRED;
    }

    static AuthorityPolicy forRole(Role role) {
        return switch (role) {
            case STUDENT -> StudentAuthorityPolicy.INSTANCE;
            case TEACHER -> TeacherAuthorityPolicy.INSTANCE;
            case ADMIN -> AdminAuthorityPolicy.INSTANCE;
        };
    }
}
