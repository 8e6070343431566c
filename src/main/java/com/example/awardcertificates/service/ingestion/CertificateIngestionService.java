package com.example.awardcertificates.service.ingestion;

import com.example.awardcertificates.exception.ExtractionException;
import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CanonicalImage;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.ExtractionResult;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.model.UploadedFile;
import com.example.awardcertificates.persistence.PersistenceGateway;
import com.example.awardcertificates.service.extraction.ExtractionClient;
import com.example.awardcertificates.service.normalization.FormatNormalizer;
import com.example.awardcertificates.service.reconciliation.FieldReconciler;
import com.example.awardcertificates.service.storage.UploadStorage;
import com.example.awardcertificates.service.submission.SubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Upload to draft: validate, store, normalize, extract, reconcile and create
 * the draft record. A failed extraction stops the pipeline after the upload
 * has been stored, so the submitter can retry without uploading again.
 */
@Service
public class CertificateIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CertificateIngestionService.class);

    private final UploadStorage uploadStorage;
    private final FormatNormalizer formatNormalizer;
    private final ExtractionClient extractionClient;
    private final FieldReconciler fieldReconciler;
    private final SubmissionService submissionService;
    private final PersistenceGateway gateway;

    public CertificateIngestionService(UploadStorage uploadStorage,
                                       FormatNormalizer formatNormalizer,
                                       ExtractionClient extractionClient,
                                       FieldReconciler fieldReconciler,
                                       SubmissionService submissionService,
                                       PersistenceGateway gateway) {
        this.uploadStorage = uploadStorage;
        this.formatNormalizer = formatNormalizer;
        this.extractionClient = extractionClient;
        this.fieldReconciler = fieldReconciler;
        this.submissionService = submissionService;
        this.gateway = gateway;
    }

    public IngestionResult ingest(byte[] rawBytes, String originalName, String declaredType, Identity submitter) {
        submissionService.ensureAcceptingSubmissions();
        SourceFormat format = uploadStorage.validate(rawBytes, originalName, declaredType);
        CanonicalImage image = formatNormalizer.normalize(rawBytes, format.primaryExtension());

        UploadedFile stored = gateway.saveUploadedFile(
                uploadStorage.store(rawBytes, originalName, format, submitter.accountId()));
        log.info("Upload {} saved as file {} for account {}", originalName, stored.fileId(), submitter.accountId());

        ExtractionResult extraction = extractOrFail(image, stored);
        CertificateRecord reconciled = fieldReconciler.reconcile(extraction, submitter, null).toBuilder()
                .file(stored)
                .extractionMethod(extractionClient.extractionMethod())
                .build();
        CertificateRecord draft = submissionService.createDraft(reconciled);
        return new IngestionResult(draft, extraction.status(), extraction.notes(),
                fieldReconciler.missingRequiredFields(draft));
    }

    /**
     * Runs extraction again on the stored upload of an existing draft. Values
     * the submitter has confirmed are kept.
     */
    public IngestionResult reextract(Long certId, Identity submitter) {
        CertificateRecord prior = submissionService.getCertificate(certId, submitter);
        if (!prior.isDraft()) {
            throw new StateException(StateException.Kind.RECORD_IMMUTABLE,
                    "Submitted certificates can no longer be changed", certId, prior.status(), null, List.of());
        }
        if (!submitter.accountId().equals(prior.submitterAccountId())) {
            throw StateException.forbidden(certId, "Only the submitter can re-run extraction for certificate " + certId);
        }
        UploadedFile upload = gateway.getUploadedFile(prior.fileId())
                .orElseThrow(() -> new IllegalStateException("Upload " + prior.fileId() + " of certificate "
                        + certId + " is missing"));
        byte[] rawBytes = uploadStorage.read(upload);
        CanonicalImage image = formatNormalizer.normalize(rawBytes, upload.format().primaryExtension());

        ExtractionResult extraction = extractOrFail(image, upload);
        CertificateRecord draft = submissionService.reconcileDraft(certId, extraction,
                extractionClient.extractionMethod(), submitter);
        log.info("Re-extracted certificate {} with status {}", certId, extraction.status());
        return new IngestionResult(draft, extraction.status(), extraction.notes(),
                fieldReconciler.missingRequiredFields(draft));
    }

    private ExtractionResult extractOrFail(CanonicalImage image, UploadedFile upload) {
        ExtractionResult extraction = extractionClient.extract(image);
        if (extraction.isFailed()) {
            log.warn("Extraction failed for file {}: {}", upload.fileId(), extraction.notes());
            throw new ExtractionException(extraction.notes(), false);
        }
        return extraction;
    }
}
