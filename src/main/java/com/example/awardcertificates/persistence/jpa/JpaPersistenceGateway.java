package com.example.awardcertificates.persistence.jpa;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.UploadedFile;
import com.example.awardcertificates.persistence.PersistenceGateway;
import com.example.awardcertificates.persistence.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(prefix = "certificates.persistence", name = "mode", havingValue = "jpa", matchIfMissing = true)
public class JpaPersistenceGateway implements PersistenceGateway {

    static final String DEADLINE_KEY = "submission_deadline";

    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceGateway.class);

    private final CertificateJpaRepository certificates;
    private final UploadedFileJpaRepository uploads;
    private final SystemConfigJpaRepository systemConfig;
    private final CertificateProperties properties;
    private final Clock clock;

    public JpaPersistenceGateway(CertificateJpaRepository certificates,
                                 UploadedFileJpaRepository uploads,
                                 SystemConfigJpaRepository systemConfig,
                                 CertificateProperties properties,
                                 Clock clock) {
        this.certificates = certificates;
        this.uploads = uploads;
        this.systemConfig = systemConfig;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long createCertificate(CertificateRecord record) {
        return certificates.save(CertificateEntity.from(record)).getId();
    }

    @Override
    @Transactional
    public UpdateResult updateCertificate(Long certId, CertificateRecord fields, CertificateStatus expectedStatus) {
        Optional<CertificateEntity> locked = certificates.findByIdForUpdate(certId);
        if (locked.isEmpty()) {
            return UpdateResult.NOT_FOUND;
        }
        CertificateEntity entity = locked.get();
        if (entity.getStatus() != expectedStatus) {
            log.debug("Certificate {} is {} but {} was expected", certId, entity.getStatus(), expectedStatus);
            return UpdateResult.CONFLICT;
        }
        entity.apply(fields);
        return UpdateResult.UPDATED;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CertificateRecord> getCertificate(Long certId) {
        return certificates.findById(certId).map(CertificateEntity::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CertificateRecord> listCertificates(String submitterAccountId, CertificateStatus status) {
        List<CertificateEntity> entities = status == null
                ? certificates.findBySubmitterAccountIdOrderByIdDesc(submitterAccountId)
                : certificates.findBySubmitterAccountIdAndStatusOrderByIdDesc(submitterAccountId, status);
        return entities.stream().map(CertificateEntity::toRecord).toList();
    }

    @Override
    @Transactional
    public boolean deleteCertificate(Long certId) {
        if (!certificates.existsById(certId)) {
            return false;
        }
        certificates.deleteById(certId);
        return true;
    }

    @Override
    @Transactional
    public UploadedFile saveUploadedFile(UploadedFile file) {
        return uploads.save(UploadedFileEntity.from(file)).toModel();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UploadedFile> getUploadedFile(Long fileId) {
        return uploads.findById(fileId).map(UploadedFileEntity::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public Deadline getDeadline() {
        return systemConfig.findById(DEADLINE_KEY)
                .map(SystemConfigEntity::getValue)
                .flatMap(this::parseDeadline)
                .orElseGet(() -> new Deadline(properties.getDeadline().getDefaultValue()));
    }

    @Override
    @Transactional
    public void setDeadline(Deadline deadline, String updatedBy) {
        SystemConfigEntity entry = systemConfig.findById(DEADLINE_KEY)
                .orElseGet(() -> new SystemConfigEntity(DEADLINE_KEY));
        entry.setValue(deadline.timestamp().toString());
        entry.setUpdatedBy(updatedBy);
        entry.setUpdatedAt(LocalDateTime.now(clock));
        systemConfig.save(entry);
    }

    private Optional<Deadline> parseDeadline(String value) {
        try {
            return Optional.of(new Deadline(LocalDateTime.parse(value.trim())));
        } catch (DateTimeParseException ex) {
            log.error("Stored deadline '{}' is unreadable; falling back to the configured default", value, ex);
            return Optional.empty();
        }
    }
}
