package com.example.awardcertificates.persistence.jpa;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Role;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "certificates", indexes = @Index(name = "idx_certificates_submitter", columnList = "submitter_account_id"))
public class CertificateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submitter_account_id", nullable = false, length = 32)
    private String submitterAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "submitter_role", nullable = false, length = 16)
    private Role submitterRole;

    @Column(name = "student_id", length = 32)
    private String studentId;

    @Column(name = "student_name", length = 100)
    private String studentName;

    @Column(length = 200)
    private String department;

    @Column(name = "competition_name", length = 500)
    private String competitionName;

    @Column(name = "award_category", length = 100)
    private String awardCategory;

    @Column(name = "award_level", length = 100)
    private String awardLevel;

    @Column(name = "competition_type", length = 100)
    private String competitionType;

    @Column(length = 500)
    private String organizer;

    @Column(name = "award_date", length = 64)
    private String awardDate;

    @Column(length = 100)
    private String advisor;

    @Column(name = "file_id", nullable = false)
    private Long fileId;

    @Column(name = "file_path", length = 1024)
    private String filePath;

    @Column(name = "extraction_method", length = 64)
    private String extractionMethod;

    @Column(name = "manual_fields", length = 512)
    private String manualFields;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CertificateStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    protected CertificateEntity() {
    }

    static CertificateEntity from(CertificateRecord record) {
        CertificateEntity entity = new CertificateEntity();
        entity.createdAt = record.createdAt();
        entity.apply(record);
        return entity;
    }

    /**
     * Copies every mutable column from {@code record}; the id and creation time stay as stored.
     */
    void apply(CertificateRecord record) {
        this.submitterAccountId = record.submitterAccountId();
        this.submitterRole = record.submitterRole();
        this.studentId = record.studentId();
        this.studentName = record.studentName();
        this.department = record.department();
        this.competitionName = record.competitionName();
        this.awardCategory = record.awardCategory();
        this.awardLevel = record.awardLevel();
        this.competitionType = record.competitionType();
        this.organizer = record.organizer();
        this.awardDate = record.awardDate();
        this.advisor = record.advisor();
        this.fileId = record.fileId();
        this.filePath = record.filePath();
        this.extractionMethod = record.extractionMethod();
        this.manualFields = encodeFields(record.manualFields());
        this.status = record.status();
        this.submittedAt = record.submittedAt();
    }

    CertificateRecord toRecord() {
        return CertificateRecord.builder()
                .certId(id)
                .submitterAccountId(submitterAccountId)
                .submitterRole(submitterRole)
                .set(CertificateField.STUDENT_ID, studentId)
                .set(CertificateField.STUDENT_NAME, studentName)
                .set(CertificateField.DEPARTMENT, department)
                .set(CertificateField.COMPETITION_NAME, competitionName)
                .set(CertificateField.AWARD_CATEGORY, awardCategory)
                .set(CertificateField.AWARD_LEVEL, awardLevel)
                .set(CertificateField.COMPETITION_TYPE, competitionType)
                .set(CertificateField.ORGANIZER, organizer)
                .set(CertificateField.AWARD_DATE, awardDate)
                .set(CertificateField.ADVISOR, advisor)
                .fileId(fileId)
                .filePath(filePath)
                .extractionMethod(extractionMethod)
                .manualFields(decodeFields(manualFields))
                .status(status)
                .createdAt(createdAt)
                .submittedAt(submittedAt)
                .build();
    }

    private static String encodeFields(Set<CertificateField> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        return fields.stream().map(CertificateField::wireName).sorted().collect(Collectors.joining(","));
    }

    private static Set<CertificateField> decodeFields(String encoded) {
        Set<CertificateField> fields = EnumSet.noneOf(CertificateField.class);
        if (encoded == null || encoded.isBlank()) {
            return fields;
        }
        Arrays.stream(encoded.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(name -> CertificateField.fromWireName(name).ifPresent(fields::add));
        return fields;
    }

    public Long getId() {
        return id;
    }

    public String getSubmitterAccountId() {
        return submitterAccountId;
    }

    public CertificateStatus getStatus() {
        return status;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
