package com.example.awardcertificates.service.reconciliation;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.Role;

import java.util.Map;

/**
 * Teachers submit on behalf of the students they advised.
 */
final class TeacherAuthorityPolicy implements AuthorityPolicy {

    static final TeacherAuthorityPolicy INSTANCE = new TeacherAuthorityPolicy();

    private TeacherAuthorityPolicy() {
    }

    @Override
    public Role role() {
        return Role.TEACHER;
    }

    @Override
    public Map<CertificateField, String> authoritativeFields(Identity identity) {
        return Map.of(CertificateField.ADVISOR, identity.displayName());
    }
}
