package com.example.awardcertificates.service.submission;

import com.example.awardcertificates.exception.StateException.Kind;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.service.submission.TransitionOutcome.Rejection;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Draft/submitted lifecycle. {@link #evaluate} is a pure function of its
 * arguments; callers pass the clock reading and the deadline fetched at the
 * moment of the call.
 */
@Component
public class SubmissionStateMachine {

    private static final DateTimeFormatter DEADLINE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * @param action  requested operation
     * @param current status of the existing record, {@code null} for {@link SubmissionAction#CREATE}
     * @param now     time of the call
     * @param deadline current submission deadline
     * @param missingRequired required fields that are still empty, only consulted for submit
     */
    public TransitionOutcome evaluate(SubmissionAction action, CertificateStatus current, LocalDateTime now,
                                      Deadline deadline, List<CertificateField> missingRequired) {
        return switch (action) {
            case ADMIN_DELETE -> TransitionOutcome.accept(action, current, current);
            case CREATE -> beforeDeadline(now, deadline)
                    ? TransitionOutcome.accept(action, null, CertificateStatus.DRAFT)
                    : deadlinePassed(action, current, deadline);
            case SAVE, EDIT -> evaluateChange(action, current, now, deadline);
            case SUBMIT -> evaluateSubmit(current, now, deadline, missingRequired);
        };
    }

    private TransitionOutcome evaluateChange(SubmissionAction action, CertificateStatus current, LocalDateTime now,
                                             Deadline deadline) {
        if (current != CertificateStatus.DRAFT) {
            return TransitionOutcome.reject(action, current, new Rejection(Kind.RECORD_IMMUTABLE,
                    "Submitted certificates can no longer be changed", List.of()));
        }
        if (!beforeDeadline(now, deadline)) {
            return deadlinePassed(action, current, deadline);
        }
        return TransitionOutcome.accept(action, current, CertificateStatus.DRAFT);
    }

    private TransitionOutcome evaluateSubmit(CertificateStatus current, LocalDateTime now, Deadline deadline,
                                             List<CertificateField> missingRequired) {
        SubmissionAction action = SubmissionAction.SUBMIT;
        if (current != CertificateStatus.DRAFT) {
            return TransitionOutcome.reject(action, current, new Rejection(Kind.INVALID_TRANSITION,
                    "Only drafts can be submitted; certificate is already "
                            + (current == null ? "missing" : current.wireName()), List.of()));
        }
        if (!beforeDeadline(now, deadline)) {
            return deadlinePassed(action, current, deadline);
        }
        if (missingRequired != null && !missingRequired.isEmpty()) {
            String labels = missingRequired.stream()
                    .map(field -> field.label() + " (" + field.wireName() + ")")
                    .collect(Collectors.joining(", "));
            return TransitionOutcome.reject(action, current, new Rejection(Kind.MISSING_REQUIRED_FIELDS,
                    "Required fields are missing: " + labels, missingRequired));
        }
        return TransitionOutcome.accept(action, current, CertificateStatus.SUBMITTED);
    }

    private boolean beforeDeadline(LocalDateTime now, Deadline deadline) {
        return !deadline.hasPassed(now);
    }

    private TransitionOutcome deadlinePassed(SubmissionAction action, CertificateStatus current, Deadline deadline) {
        return TransitionOutcome.reject(action, current, new Rejection(Kind.DEADLINE_PASSED,
                "The submission deadline " + DEADLINE_FORMAT.format(deadline.timestamp()) + " has passed",
                List.of()));
    }
}
