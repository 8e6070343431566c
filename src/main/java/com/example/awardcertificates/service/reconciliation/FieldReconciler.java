package com.example.awardcertificates.service.reconciliation;

import com.example.awardcertificates.exception.ReconciliationException;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.ExtractionResult;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges extracted values with the submitter's account according to the
 * submitter's {@link AuthorityPolicy}. Output is always a draft; status
 * changes belong to the submission state machine.
 */
@Component
public class FieldReconciler {

    private static final Logger log = LoggerFactory.getLogger(FieldReconciler.class);

    /**
     * @param extraction result of the recognition call, never failed
     * @param identity   the submitter
     * @param priorDraft existing draft being re-extracted, or {@code null} for a new upload
     */
    public CertificateRecord reconcile(ExtractionResult extraction, Identity identity, CertificateRecord priorDraft) {
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(identity, "identity");
        if (extraction.isFailed()) {
            throw new ReconciliationException("A failed extraction cannot be reconciled: " + extraction.notes(), List.of());
        }
        CertificateRecord.Builder builder = startFrom(priorDraft, identity);
        AuthorityPolicy policy = AuthorityPolicy.forRole(identity.role());
        Map<CertificateField, String> authoritative = policy.authoritativeFields(identity);

        for (CertificateField field : CertificateField.values()) {
            if (authoritative.containsKey(field)) {
                builder.set(field, authoritative.get(field));
                continue;
            }
            if (builder.isManual(field)) {
                continue;
            }
            Optional<String> extracted = extraction.value(field).map(value -> canonicalValue(field, value));
            if (extracted.isEmpty()) {
                continue;
            }
            if (!isWellFormed(field, extracted.get())) {
                log.debug("Discarding extracted {} '{}' with invalid format", field, extracted.get());
                continue;
            }
            builder.set(field, extracted.get());
        }
        policy.fallbackFields(identity).forEach((field, value) -> {
            if (builder.get(field) == null) {
                builder.set(field, value);
            }
        });
        return builder.build();
    }

    /**
     * Applies values the submitter typed in. Every targeted field is marked as
     * manually confirmed so later extractions leave it alone.
     *
     * @throws ReconciliationException when a change targets an account-owned
     *                                 field or violates a field format
     */
    public CertificateRecord applyChanges(CertificateRecord draft, FieldChanges changes, Identity submitter) {
        if (changes == null || changes.isEmpty()) {
            return draft;
        }
        Map<CertificateField, String> authoritative =
                AuthorityPolicy.forRole(submitter.role()).authoritativeFields(submitter);
        List<CertificateField> conflicts = new ArrayList<>();
        List<CertificateField> malformed = new ArrayList<>();
        CertificateRecord.Builder builder = draft.toBuilder();

        for (CertificateField field : changes.fields()) {
            String value = canonicalValue(field, changes.value(field).orElse(""));
            if (authoritative.containsKey(field)) {
                if (!authoritative.get(field).equals(value)) {
                    conflicts.add(field);
                }
                continue;
            }
            if (!value.isEmpty() && !isWellFormed(field, value)) {
                malformed.add(field);
                continue;
            }
            builder.set(field, value).markManual(field);
        }
        if (!conflicts.isEmpty()) {
            throw new ReconciliationException("Fields " + wireNames(conflicts) + " are taken from the "
                    + submitter.role().wireName() + " account and cannot be changed", conflicts);
        }
        if (!malformed.isEmpty()) {
            throw new ReconciliationException("Invalid value for " + wireNames(malformed)
                    + ": student number must be 13 digits", malformed);
        }
        return builder.build();
    }

    public List<CertificateField> missingRequiredFields(CertificateRecord record) {
        Role role = record.submitterRole() == null ? Role.STUDENT : record.submitterRole();
        return AuthorityPolicy.forRole(role).requiredFields().stream()
                .filter(field -> !record.has(field))
                .sorted()
                .toList();
    }

    private CertificateRecord.Builder startFrom(CertificateRecord priorDraft, Identity identity) {
        if (priorDraft == null) {
            return CertificateRecord.builder().submitter(identity).status(CertificateStatus.DRAFT);
        }
        if (priorDraft.status() != CertificateStatus.DRAFT) {
            throw new ReconciliationException("Prior record " + priorDraft.certId() + " is "
                    + priorDraft.status().wireName() + ", only drafts can be reconciled again", List.of());
        }
        if (!identity.accountId().equals(priorDraft.submitterAccountId())
                || identity.role() != priorDraft.submitterRole()) {
            throw new ReconciliationException("Prior draft " + priorDraft.certId()
                    + " belongs to a different submitter", List.of());
        }
        return priorDraft.toBuilder();
    }

    private static String canonicalValue(CertificateField field, String value) {
        String trimmed = value == null ? "" : value.trim();
        if (field == CertificateField.STUDENT_ID) {
            return trimmed.replaceAll("\\s+", "");
        }
        return trimmed;
    }

    private static boolean isWellFormed(CertificateField field, String value) {
        if (field == CertificateField.STUDENT_ID) {
            return Role.STUDENT.isValidAccountId(value);
        }
        return true;
    }

    private static String wireNames(List<CertificateField> fields) {
        return fields.stream().map(CertificateField::wireName).toList().toString();
    }
}
