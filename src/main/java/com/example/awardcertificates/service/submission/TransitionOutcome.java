package com.example.awardcertificates.service.submission;

import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;

import java.util.List;

/**
 * Result of evaluating one action against the lifecycle: either the status the
 * record moves to, or a typed rejection.
 */
public record TransitionOutcome(
        SubmissionAction action,
        CertificateStatus from,
        CertificateStatus to,
        Rejection rejection) {

    public static TransitionOutcome accept(SubmissionAction action, CertificateStatus from, CertificateStatus to) {
        return new TransitionOutcome(action, from, to, null);
    }

    public static TransitionOutcome reject(SubmissionAction action, CertificateStatus from, Rejection rejection) {
        return new TransitionOutcome(action, from, from, rejection);
    }

    public boolean accepted() {
        return rejection == null;
    }

    /**
     * @throws StateException describing the rejection, if any
     */
    public TransitionOutcome orThrow(Long certId, Deadline deadline) {
        if (rejection != null) {
            throw new StateException(rejection.kind(), rejection.message(), certId, from, deadline,
                    rejection.missingFields());
        }
        return this;
    }

    public record Rejection(StateException.Kind kind, String message, List<CertificateField> missingFields) {

        public Rejection {
            missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        }
    }
}
