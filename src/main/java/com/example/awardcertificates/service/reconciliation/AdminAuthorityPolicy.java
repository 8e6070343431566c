package com.example.awardcertificates.service.reconciliation;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.Role;

import java.util.Map;

final class AdminAuthorityPolicy implements AuthorityPolicy {

    static final AdminAuthorityPolicy INSTANCE = new AdminAuthorityPolicy();

    private AdminAuthorityPolicy() {
    }

    @Override
    public Role role() {
        return Role.ADMIN;
    }

    @Override
    public Map<CertificateField, String> authoritativeFields(Identity identity) {
        return Map.of();
    }
}
