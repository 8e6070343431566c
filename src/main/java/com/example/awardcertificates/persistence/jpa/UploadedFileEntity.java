package com.example.awardcertificates.persistence.jpa;

import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.model.UploadedFile;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "uploaded_files")
public class UploadedFileEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_account_id", nullable = false, length = 32)
    private String ownerAccountId;

    @Column(name = "original_name", length = 255)
    private String originalName;

    @Column(name = "stored_path", nullable = false, length = 1024)
    private String storedPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private SourceFormat format;

    @Column(name = "byte_size", nullable = false)
    private long byteSize;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    protected UploadedFileEntity() {
    }

    static UploadedFileEntity from(UploadedFile file) {
        UploadedFileEntity entity = new UploadedFileEntity();
        entity.ownerAccountId = file.ownerAccountId();
        entity.originalName = file.originalName();
        entity.storedPath = file.storedPath();
        entity.format = file.format();
        entity.byteSize = file.byteSize();
        entity.uploadedAt = file.uploadTimestamp();
        return entity;
    }

    UploadedFile toModel() {
        return new UploadedFile(id, ownerAccountId, originalName, storedPath, format, byteSize, uploadedAt);
    }

    public Long getId() {
        return id;
    }
}
