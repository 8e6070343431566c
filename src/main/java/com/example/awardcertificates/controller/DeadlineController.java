package com.example.awardcertificates.controller;

import com.example.awardcertificates.controller.dto.DeadlineRequest;
import com.example.awardcertificates.controller.dto.DeadlineResponse;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.service.identity.AccountDirectory;
import com.example.awardcertificates.service.submission.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Deadline", description = "Institution-wide submission deadline")
public class DeadlineController {

    private final SubmissionService submissionService;
    private final AccountDirectory accountDirectory;
    private final Clock clock;

    public DeadlineController(SubmissionService submissionService, AccountDirectory accountDirectory, Clock clock) {
        this.submissionService = submissionService;
        this.accountDirectory = accountDirectory;
        this.clock = clock;
    }

    @GetMapping("/deadline")
    @Operation(summary = "Show the current submission deadline")
    public ResponseEntity<DeadlineResponse> current() {
        return ResponseEntity.ok(DeadlineResponse.of(submissionService.currentDeadline(), LocalDateTime.now(clock)));
    }

    @PutMapping("/admin/deadline")
    @Operation(summary = "Move the submission deadline", description = "Administrators only.")
    public ResponseEntity<DeadlineResponse> update(@RequestHeader(CertificateController.ACCOUNT_HEADER) String accountId,
                                                   @Valid @RequestBody DeadlineRequest request) {
        Identity admin = accountDirectory.require(accountId);
        Deadline deadline = submissionService.updateDeadline(request.deadline(), admin);
        return ResponseEntity.ok(DeadlineResponse.of(deadline, LocalDateTime.now(clock)));
    }
}
