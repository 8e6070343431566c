package com.example.awardcertificates.exception;

import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;

import java.util.List;

public class StateException extends CertificateException {

    public enum Kind {
        INVALID_TRANSITION,
        DEADLINE_PASSED,
        MISSING_REQUIRED_FIELDS,
        RECORD_IMMUTABLE,
        CONFLICT,
        NOT_FOUND,
        FORBIDDEN
    }

    private final Kind kind;
    private final Long certId;
    private final CertificateStatus currentStatus;
    private final Deadline deadline;
    private final List<CertificateField> missingFields;

    public StateException(Kind kind, String message, Long certId, CertificateStatus currentStatus,
                          Deadline deadline, List<CertificateField> missingFields) {
        super(message);
        this.kind = kind;
        this.certId = certId;
        this.currentStatus = currentStatus;
        this.deadline = deadline;
        this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static StateException notFound(Long certId) {
        return new StateException(Kind.NOT_FOUND, "Certificate " + certId + " does not exist", certId, null, null, null);
    }

    public static StateException forbidden(Long certId, String message) {
        return new StateException(Kind.FORBIDDEN, message, certId, null, null, null);
    }

    public static StateException conflict(Long certId, CertificateStatus expected) {
        return new StateException(Kind.CONFLICT,
                "Certificate " + certId + " was modified concurrently and is no longer " + expected.wireName(),
                certId, null, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Long getCertId() {
        return certId;
    }

    public CertificateStatus getCurrentStatus() {
        return currentStatus;
    }

    public Deadline getDeadline() {
        return deadline;
    }

    public List<CertificateField> getMissingFields() {
        return missingFields;
    }
}
