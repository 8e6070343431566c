package com.example.awardcertificates.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Closed set of account roles. Each role carries the format its account
 * identifiers must follow.
 */
public enum Role {
    STUDENT(Pattern.compile("\\d{13}"), "student number must be 13 digits"),
    TEACHER(Pattern.compile("\\d{8}"), "staff number must be 8 digits"),
    ADMIN(Pattern.compile("\\S+"), "admin id must not be blank");

    private final Pattern accountIdPattern;
    private final String formatDescription;

    Role(Pattern accountIdPattern, String formatDescription) {
        this.accountIdPattern = accountIdPattern;
        this.formatDescription = formatDescription;
    }

    public boolean isValidAccountId(String accountId) {
        return accountId != null && accountIdPattern.matcher(accountId).matches();
    }

    public String formatDescription() {
        return formatDescription;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role must not be blank");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
