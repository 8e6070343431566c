package com.example.awardcertificates.persistence;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Repository
@ConditionalOnProperty(prefix = "certificates.persistence", name = "mode", havingValue = "memory")
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceGateway.class);

    private final Map<Long, CertificateRecord> certificates = new ConcurrentHashMap<>();
    private final Map<Long, UploadedFile> uploads = new ConcurrentHashMap<>();
    private final AtomicLong certificateSequence = new AtomicLong();
    private final AtomicLong uploadSequence = new AtomicLong();
    private final AtomicReference<Deadline> deadline = new AtomicReference<>();
    private final Deadline defaultDeadline;

    public InMemoryPersistenceGateway(CertificateProperties properties) {
        this.defaultDeadline = new Deadline(properties.getDeadline().getDefaultValue());
        log.info("Using in-memory certificate storage; records are lost on restart");
    }

    @Override
    public Long createCertificate(CertificateRecord record) {
        Long id = certificateSequence.incrementAndGet();
        certificates.put(id, record.toBuilder().certId(id).build());
        return id;
    }

    @Override
    public UpdateResult updateCertificate(Long certId, CertificateRecord fields, CertificateStatus expectedStatus) {
        AtomicReference<UpdateResult> result = new AtomicReference<>(UpdateResult.NOT_FOUND);
        certificates.computeIfPresent(certId, (id, current) -> {
            if (current.status() != expectedStatus) {
                result.set(UpdateResult.CONFLICT);
                return current;
            }
            result.set(UpdateResult.UPDATED);
            return fields.toBuilder().certId(id).createdAt(current.createdAt()).build();
        });
        return result.get();
    }

    @Override
    public Optional<CertificateRecord> getCertificate(Long certId) {
        return Optional.ofNullable(certificates.get(certId));
    }

    @Override
    public List<CertificateRecord> listCertificates(String submitterAccountId, CertificateStatus status) {
        return certificates.values().stream()
                .filter(record -> Objects.equals(record.submitterAccountId(), submitterAccountId))
                .filter(record -> status == null || record.status() == status)
                .sorted(Comparator.comparing(CertificateRecord::certId).reversed())
                .toList();
    }

    @Override
    public boolean deleteCertificate(Long certId) {
        return certificates.remove(certId) != null;
    }

    @Override
    public UploadedFile saveUploadedFile(UploadedFile file) {
        UploadedFile stored = file.withFileId(uploadSequence.incrementAndGet());
        uploads.put(stored.fileId(), stored);
        return stored;
    }

    @Override
    public Optional<UploadedFile> getUploadedFile(Long fileId) {
        return Optional.ofNullable(uploads.get(fileId));
    }

    @Override
    public Deadline getDeadline() {
        Deadline stored = deadline.get();
        return stored != null ? stored : defaultDeadline;
    }

    @Override
    public void setDeadline(Deadline newDeadline, String updatedBy) {
        deadline.set(Objects.requireNonNull(newDeadline, "deadline"));
    }
}
