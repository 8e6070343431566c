package com.example.awardcertificates.persistence.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * Key/value row for institution-wide settings such as the submission deadline.
 */
@Entity
@Table(name = "system_config")
public class SystemConfigEntity {

    @Id
    @Column(name = "config_key", length = 64)
    private String key;

    @Column(name = "config_value", nullable = false, length = 255)
    private String value;

    @Column(name = "updated_by", length = 32)
    private String updatedBy;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected SystemConfigEntity() {
    }

    public SystemConfigEntity(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
