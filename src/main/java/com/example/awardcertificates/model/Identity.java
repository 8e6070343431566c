package com.example.awardcertificates.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

/**
 * Submitter identity as supplied by the account directory. Only read by the
 * certificate pipeline.
 */
@Schema(description = "Account of the person submitting a certificate")
public record Identity(
        @Schema(description = "Role-typed account identifier", example = "2024010101001") String accountId,
        @Schema(description = "Display name", example = "张三") String displayName,
        @Schema(description = "Account role") Role role,
        @Schema(description = "Department or school", example = "数学学院") String department) {

    public Identity {
        Objects.requireNonNull(role, "role");
        if (!role.isValidAccountId(accountId)) {
            throw new IllegalArgumentException("Invalid account id '" + accountId + "': " + role.formatDescription());
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name is required for account " + accountId);
        }
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
