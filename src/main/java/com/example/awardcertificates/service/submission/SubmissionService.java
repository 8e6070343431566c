package com.example.awardcertificates.service.submission;

import com.example.awardcertificates.exception.ReconciliationException;
import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.ExtractionResult;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.persistence.PersistenceGateway;
import com.example.awardcertificates.persistence.UpdateResult;
import com.example.awardcertificates.service.reconciliation.FieldReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Runs every lifecycle operation through {@link SubmissionStateMachine}. The
 * clock is read and the deadline fetched at the moment of each call.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final PersistenceGateway gateway;
    private final SubmissionStateMachine stateMachine;
    private final FieldReconciler reconciler;
    private final Clock clock;

    public SubmissionService(PersistenceGateway gateway,
                             SubmissionStateMachine stateMachine,
                             FieldReconciler reconciler,
                             Clock clock) {
        this.gateway = gateway;
        this.stateMachine = stateMachine;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    /**
     * Rejects new drafts once the deadline has passed. Called before any
     * expensive work on an upload.
     */
    public void ensureAcceptingSubmissions() {
        Deadline deadline = gateway.getDeadline();
        stateMachine.evaluate(SubmissionAction.CREATE, null, now(), deadline, List.of())
                .orThrow(null, deadline);
    }

    public CertificateRecord createDraft(CertificateRecord draft) {
        Objects.requireNonNull(draft, "draft");
        Deadline deadline = gateway.getDeadline();
        LocalDateTime now = now();
        stateMachine.evaluate(SubmissionAction.CREATE, null, now, deadline, List.of()).orThrow(null, deadline);
        if (draft.fileId() == null || gateway.getUploadedFile(draft.fileId()).isEmpty()) {
            throw new ReconciliationException("Certificate must reference a stored upload, got file id "
                    + draft.fileId(), List.of());
        }
        CertificateRecord toStore = draft.toBuilder()
                .certId(null)
                .status(CertificateStatus.DRAFT)
                .createdAt(now)
                .submittedAt(null)
                .build();
        Long certId = gateway.createCertificate(toStore);
        log.info("Created draft certificate {} for account {}", certId, draft.submitterAccountId());
        return toStore.toBuilder().certId(certId).build();
    }

    /**
     * Persists the full set of values shown to the submitter. Every supplied
     * field counts as confirmed.
     */
    public CertificateRecord save(Long certId, FieldChanges values, Identity submitter) {
        return change(SubmissionAction.SAVE, certId, values, submitter);
    }

    public CertificateRecord edit(Long certId, FieldChanges changes, Identity submitter) {
        return change(SubmissionAction.EDIT, certId, changes, submitter);
    }

    /**
     * Merges a new extraction into the stored draft. The draft is read after
     * recognition has finished, so values confirmed while it was running are
     * kept.
     */
    public CertificateRecord reconcileDraft(Long certId, ExtractionResult extraction, String extractionMethod,
                                            Identity submitter) {
        CertificateRecord current = loadOwned(certId, submitter);
        Deadline deadline = gateway.getDeadline();
        stateMachine.evaluate(SubmissionAction.EDIT, current.status(), now(), deadline, List.of())
                .orThrow(certId, deadline);
        CertificateRecord reconciled = reconciler.reconcile(extraction, submitter, current).toBuilder()
                .extractionMethod(extractionMethod)
                .build();
        return persist(current, reconciled);
    }

    public CertificateRecord submit(Long certId, FieldChanges finalChanges, Identity submitter) {
        CertificateRecord current = loadOwned(certId, submitter);
        Deadline deadline = gateway.getDeadline();
        LocalDateTime now = now();
        CertificateRecord updated = current;
        if (finalChanges != null && !finalChanges.isEmpty()) {
            stateMachine.evaluate(SubmissionAction.EDIT, current.status(), now, deadline, List.of())
                    .orThrow(certId, deadline);
            updated = reconciler.applyChanges(current, finalChanges, submitter);
        }
        List<CertificateField> missing = reconciler.missingRequiredFields(updated);
        stateMachine.evaluate(SubmissionAction.SUBMIT, current.status(), now, deadline, missing)
                .orThrow(certId, deadline);

        CertificateRecord submitted = updated.toBuilder()
                .status(CertificateStatus.SUBMITTED)
                .submittedAt(now)
                .build();
        CertificateRecord stored = persist(current, submitted);
        log.info("Certificate {} submitted by account {}", certId, submitter.accountId());
        return stored;
    }

    public void adminDelete(Long certId, Identity admin) {
        requireAdmin(admin, certId);
        CertificateRecord current = gateway.getCertificate(certId).orElseThrow(() -> StateException.notFound(certId));
        Deadline deadline = gateway.getDeadline();
        stateMachine.evaluate(SubmissionAction.ADMIN_DELETE, current.status(), now(), deadline, List.of())
                .orThrow(certId, deadline);
        if (!gateway.deleteCertificate(certId)) {
            throw StateException.notFound(certId);
        }
        log.info("Administrator {} deleted {} certificate {}", admin.accountId(), current.status().wireName(), certId);
    }

    public Deadline currentDeadline() {
        return gateway.getDeadline();
    }

    public Deadline updateDeadline(LocalDateTime timestamp, Identity admin) {
        requireAdmin(admin, null);
        Deadline deadline = new Deadline(Objects.requireNonNull(timestamp, "timestamp"));
        gateway.setDeadline(deadline, admin.accountId());
        log.info("Administrator {} moved the submission deadline to {}", admin.accountId(), timestamp);
        return deadline;
    }

    /**
     * Returns a certificate visible to {@code caller}: its submitter or an administrator.
     */
    public CertificateRecord getCertificate(Long certId, Identity caller) {
        CertificateRecord record = gateway.getCertificate(certId).orElseThrow(() -> StateException.notFound(certId));
        if (!caller.isAdmin() && !caller.accountId().equals(record.submitterAccountId())) {
            throw StateException.forbidden(certId, "Certificate " + certId + " belongs to another account");
        }
        return record;
    }

    public List<CertificateRecord> listCertificates(Identity caller, CertificateStatus status) {
        return gateway.listCertificates(caller.accountId(), status);
    }

    public List<CertificateField> missingRequiredFields(CertificateRecord record) {
        return reconciler.missingRequiredFields(record);
    }

    private CertificateRecord change(SubmissionAction action, Long certId, FieldChanges changes, Identity submitter) {
        CertificateRecord current = loadOwned(certId, submitter);
        Deadline deadline = gateway.getDeadline();
        stateMachine.evaluate(action, current.status(), now(), deadline, List.of()).orThrow(certId, deadline);
        CertificateRecord updated = reconciler.applyChanges(current, changes, submitter);
        CertificateRecord stored = persist(current, updated);
        log.debug("{} applied to certificate {} ({} fields)", action, certId,
                changes == null ? 0 : changes.fields().size());
        return stored;
    }

    private CertificateRecord persist(CertificateRecord current, CertificateRecord updated) {
        Long certId = current.certId();
        UpdateResult result = gateway.updateCertificate(certId, updated, current.status());
        return switch (result) {
            case UPDATED -> updated.toBuilder().certId(certId).createdAt(current.createdAt()).build();
            case CONFLICT -> throw StateException.conflict(certId, current.status());
            case NOT_FOUND -> throw StateException.notFound(certId);
        };
    }

    private CertificateRecord loadOwned(Long certId, Identity submitter) {
        CertificateRecord record = gateway.getCertificate(certId).orElseThrow(() -> StateException.notFound(certId));
        if (!submitter.accountId().equals(record.submitterAccountId())) {
            throw StateException.forbidden(certId, "Only the submitter can change certificate " + certId);
        }
        return record;
    }

    private void requireAdmin(Identity caller, Long certId) {
        if (caller == null || !caller.isAdmin()) {
            throw StateException.forbidden(certId, "Administrator role required");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
