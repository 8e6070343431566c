package com.example.awardcertificates.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(description = "Stored certificate upload")
public record UploadedFile(
        @Schema(description = "Upload identifier", example = "17") Long fileId,
        @Schema(description = "Account that uploaded the file", example = "2024010101001") String ownerAccountId,
        @Schema(description = "File name supplied by the client", example = "award.pdf") String originalName,
        @Schema(description = "Location of the stored bytes") String storedPath,
        @Schema(description = "Accepted source format") SourceFormat format,
        @Schema(description = "Size in bytes", example = "204800") long byteSize,
        @Schema(description = "Upload time") LocalDateTime uploadTimestamp) {

    public UploadedFile withFileId(Long id) {
        return new UploadedFile(id, ownerAccountId, originalName, storedPath, format, byteSize, uploadTimestamp);
    }
}
