package com.example.awardcertificates.persistence;

import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.UploadedFile;

import java.util.List;
import java.util.Optional;

/**
 * Storage seam for certificates, uploads and the submission deadline.
 * Implementations must make {@link #updateCertificate} an atomic
 * compare-and-set on the stored status.
 */
public interface PersistenceGateway {

    /**
     * Stores a new record and returns its identifier.
     */
    Long createCertificate(CertificateRecord record);

    /**
     * Replaces the stored fields of {@code certId} only while its stored status
     * still equals {@code expectedStatus}. The identifier and creation time of the
     * stored record are kept.
     */
    UpdateResult updateCertificate(Long certId, CertificateRecord fields, CertificateStatus expectedStatus);

    Optional<CertificateRecord> getCertificate(Long certId);

    /**
     * @param status optional filter, {@code null} for every status
     */
    List<CertificateRecord> listCertificates(String submitterAccountId, CertificateStatus status);

    boolean deleteCertificate(Long certId);

    UploadedFile saveUploadedFile(UploadedFile file);

    Optional<UploadedFile> getUploadedFile(Long fileId);

    /**
     * Returns the stored deadline, or the configured default when none was set.
     */
    Deadline getDeadline();

    void setDeadline(Deadline deadline, String updatedBy);
}
