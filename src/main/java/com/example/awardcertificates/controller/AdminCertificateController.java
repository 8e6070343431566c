package com.example.awardcertificates.controller;

import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.service.identity.AccountDirectory;
import com.example.awardcertificates.service.submission.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/certificates")
@Tag(name = "Administration", description = "Administrator certificate maintenance")
public class AdminCertificateController {

    private final SubmissionService submissionService;
    private final AccountDirectory accountDirectory;

    public AdminCertificateController(SubmissionService submissionService, AccountDirectory accountDirectory) {
        this.submissionService = submissionService;
        this.accountDirectory = accountDirectory;
    }

    @DeleteMapping("/{certId}")
    @Operation(summary = "Delete a certificate", description = "Removes drafts and submitted certificates alike.")
    public ResponseEntity<Void> delete(@RequestHeader(CertificateController.ACCOUNT_HEADER) String accountId,
                                       @PathVariable Long certId) {
        Identity admin = accountDirectory.require(accountId);
        submissionService.adminDelete(certId, admin);
        return ResponseEntity.noContent().build();
    }
}
