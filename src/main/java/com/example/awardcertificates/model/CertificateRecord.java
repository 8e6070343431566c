package com.example.awardcertificates.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Persistent certificate record. Instances are immutable; changes go through
 * {@link #toBuilder()}.
 */
public record CertificateRecord(
        Long certId,
        String submitterAccountId,
        Role submitterRole,
        String studentId,
        String studentName,
        String department,
        String competitionName,
        String awardCategory,
        String awardLevel,
        String competitionType,
        String organizer,
        String awardDate,
        String advisor,
        Long fileId,
        String filePath,
        String extractionMethod,
        Set<CertificateField> manualFields,
        CertificateStatus status,
        LocalDateTime createdAt,
        LocalDateTime submittedAt) {

    public CertificateRecord {
        manualFields = manualFields == null || manualFields.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(manualFields));
        if (status == null) {
            status = CertificateStatus.DRAFT;
        }
    }

    public String get(CertificateField field) {
        return switch (field) {
            case STUDENT_ID -> studentId;
            case STUDENT_NAME -> studentName;
            case DEPARTMENT -> department;
            case COMPETITION_NAME -> competitionName;
            case AWARD_CATEGORY -> awardCategory;
            case AWARD_LEVEL -> awardLevel;
            case COMPETITION_TYPE -> competitionType;
            case ORGANIZER -> organizer;
            case AWARD_DATE -> awardDate;
            case ADVISOR -> advisor;
        };
    }

    public boolean has(CertificateField field) {
        String value = get(field);
        return value != null && !value.isBlank();
    }

    public boolean isDraft() {
        return status == CertificateStatus.DRAFT;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Long certId;
        private String submitterAccountId;
        private Role submitterRole;
        private String studentId;
        private String studentName;
        private String department;
        private String competitionName;
        private String awardCategory;
        private String awardLevel;
        private String competitionType;
        private String organizer;
        private String awardDate;
        private String advisor;
        private Long fileId;
        private String filePath;
        private String extractionMethod;
        private final Set<CertificateField> manualFields = EnumSet.noneOf(CertificateField.class);
        private CertificateStatus status = CertificateStatus.DRAFT;
        private LocalDateTime createdAt;
        private LocalDateTime submittedAt;

        private Builder() {
        }

        private Builder(CertificateRecord source) {
            this.certId = source.certId;
            this.submitterAccountId = source.submitterAccountId;
            this.submitterRole = source.submitterRole;
            this.studentId = source.studentId;
            this.studentName = source.studentName;
            this.department = source.department;
            this.competitionName = source.competitionName;
            this.awardCategory = source.awardCategory;
            this.awardLevel = source.awardLevel;
            this.competitionType = source.competitionType;
            this.organizer = source.organizer;
            this.awardDate = source.awardDate;
            this.advisor = source.advisor;
            this.fileId = source.fileId;
            this.filePath = source.filePath;
            this.extractionMethod = source.extractionMethod;
            this.manualFields.addAll(source.manualFields);
            this.status = source.status;
            this.createdAt = source.createdAt;
            this.submittedAt = source.submittedAt;
        }

        public Builder certId(Long certId) {
            this.certId = certId;
            return this;
        }

        public Builder submitter(Identity identity) {
            this.submitterAccountId = identity.accountId();
            this.submitterRole = identity.role();
            return this;
        }

        public Builder submitterAccountId(String submitterAccountId) {
            this.submitterAccountId = submitterAccountId;
            return this;
        }

        public Builder submitterRole(Role submitterRole) {
            this.submitterRole = submitterRole;
            return this;
        }

        public Builder set(CertificateField field, String value) {
            String normalized = value == null || value.isBlank() ? null : value.trim();
            switch (field) {
                case STUDENT_ID -> studentId = normalized;
                case STUDENT_NAME -> studentName = normalized;
                case DEPARTMENT -> department = normalized;
                case COMPETITION_NAME -> competitionName = normalized;
                case AWARD_CATEGORY -> awardCategory = normalized;
                case AWARD_LEVEL -> awardLevel = normalized;
                case COMPETITION_TYPE -> competitionType = normalized;
                case ORGANIZER -> organizer = normalized;
                case AWARD_DATE -> awardDate = normalized;
                case ADVISOR -> advisor = normalized;
            }
            return this;
        }

        public String get(CertificateField field) {
            return switch (field) {
                case STUDENT_ID -> studentId;
                case STUDENT_NAME -> studentName;
                case DEPARTMENT -> department;
                case COMPETITION_NAME -> competitionName;
                case AWARD_CATEGORY -> awardCategory;
                case AWARD_LEVEL -> awardLevel;
                case COMPETITION_TYPE -> competitionType;
                case ORGANIZER -> organizer;
                case AWARD_DATE -> awardDate;
                case ADVISOR -> advisor;
            };
        }

        public Builder markManual(CertificateField field) {
            manualFields.add(field);
            return this;
        }

        public boolean isManual(CertificateField field) {
            return manualFields.contains(field);
        }

        public Builder file(UploadedFile file) {
            this.fileId = file.fileId();
            this.filePath = file.storedPath();
            return this;
        }

        public Builder fileId(Long fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder extractionMethod(String extractionMethod) {
            this.extractionMethod = extractionMethod;
            return this;
        }

        public Builder manualFields(Set<CertificateField> fields) {
            this.manualFields.clear();
            if (fields != null) {
                this.manualFields.addAll(fields);
            }
            return this;
        }

        public Builder status(CertificateStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(LocalDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder submittedAt(LocalDateTime submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public CertificateRecord build() {
            return new CertificateRecord(certId, submitterAccountId, submitterRole, studentId, studentName,
                    department, competitionName, awardCategory, awardLevel, competitionType, organizer,
                    awardDate, advisor, fileId, filePath, extractionMethod, manualFields, status, createdAt,
                    submittedAt);
        }
    }
}
