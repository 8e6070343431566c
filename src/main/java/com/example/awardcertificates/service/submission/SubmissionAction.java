package com.example.awardcertificates.service.submission;

public enum SubmissionAction {
    CREATE,
    SAVE,
    EDIT,
    SUBMIT,
    ADMIN_DELETE
}
