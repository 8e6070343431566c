package com.example.awardcertificates.controller;

import com.example.awardcertificates.controller.dto.CertificateResponse;
import com.example.awardcertificates.controller.dto.FieldChangesRequest;
import com.example.awardcertificates.controller.dto.IngestionResponse;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.model.Identity;
import com.example.awardcertificates.service.identity.AccountDirectory;
import com.example.awardcertificates.service.ingestion.CertificateIngestionService;
import com.example.awardcertificates.service.submission.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/certificates")
@Tag(name = "Certificates", description = "Upload, review and submit award certificates")
public class CertificateController {

    static final String ACCOUNT_HEADER = "X-Account-Id";

    private final CertificateIngestionService ingestionService;
    private final SubmissionService submissionService;
    private final AccountDirectory accountDirectory;

    public CertificateController(CertificateIngestionService ingestionService,
                                 SubmissionService submissionService,
                                 AccountDirectory accountDirectory) {
        this.ingestionService = ingestionService;
        this.submissionService = submissionService;
        this.accountDirectory = accountDirectory;
    }

    @Operation(
            summary = "Upload a certificate",
            description = "Stores the file, reads the first page and creates a draft pre-filled from the account "
                    + "and the recognized certificate text.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Draft created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = IngestionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Unsupported or unreadable file", content = @Content),
            @ApiResponse(responseCode = "422", description = "Submission deadline has passed", content = @Content),
            @ApiResponse(responseCode = "502", description = "Recognition service failed", content = @Content)
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResponse> upload(
            @Parameter(description = "Account performing the upload", required = true)
            @RequestHeader(ACCOUNT_HEADER) String accountId,
            @Parameter(description = "Certificate as PDF, JPG, PNG or BMP", required = true)
            @RequestPart("file") MultipartFile file) {
        Identity submitter = accountDirectory.require(accountId);
        byte[] bytes = readBytes(file);
        IngestionResponse response = IngestionResponse.from(
                ingestionService.ingest(bytes, file.getOriginalFilename(), file.getContentType(), submitter));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    @Operation(summary = "List the caller's certificates")
    public ResponseEntity<List<CertificateResponse>> list(
            @RequestHeader(ACCOUNT_HEADER) String accountId,
            @Parameter(description = "Optional status filter: draft or submitted")
            @RequestParam(name = "status", required = false) String status) {
        Identity caller = accountDirectory.require(accountId);
        CertificateStatus filter = status == null || status.isBlank() ? null : CertificateStatus.fromWireName(status);
        List<CertificateResponse> body = submissionService.listCertificates(caller, filter).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{certId}")
    @Operation(summary = "Fetch one certificate", description = "Visible to its submitter and to administrators.")
    public ResponseEntity<CertificateResponse> get(@RequestHeader(ACCOUNT_HEADER) String accountId,
                                                   @PathVariable Long certId) {
        Identity caller = accountDirectory.require(accountId);
        return ResponseEntity.ok(toResponse(submissionService.getCertificate(certId, caller)));
    }

    @PatchMapping(value = "/{certId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Edit draft fields", description = "Only the listed fields change.")
    public ResponseEntity<CertificateResponse> edit(@RequestHeader(ACCOUNT_HEADER) String accountId,
                                                    @PathVariable Long certId,
                                                    @RequestBody FieldChangesRequest request) {
        Identity submitter = accountDirectory.require(accountId);
        return ResponseEntity.ok(toResponse(submissionService.edit(certId, request.toChanges(), submitter)));
    }

    @PutMapping(value = "/{certId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Save the draft", description = "Persists the values shown to the submitter as confirmed.")
    public ResponseEntity<CertificateResponse> save(@RequestHeader(ACCOUNT_HEADER) String accountId,
                                                    @PathVariable Long certId,
                                                    @RequestBody FieldChangesRequest request) {
        Identity submitter = accountDirectory.require(accountId);
        return ResponseEntity.ok(toResponse(submissionService.save(certId, request.toChanges(), submitter)));
    }

    @PostMapping("/{certId}/submit")
    @Operation(summary = "Submit a draft", description = "Optional final changes are applied before submitting.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Certificate submitted"),
            @ApiResponse(responseCode = "409", description = "Certificate already submitted", content = @Content),
            @ApiResponse(responseCode = "422", description = "Deadline passed or required fields missing",
                    content = @Content)
    })
    public ResponseEntity<CertificateResponse> submit(@RequestHeader(ACCOUNT_HEADER) String accountId,
                                                      @PathVariable Long certId,
                                                      @RequestBody(required = false) FieldChangesRequest request) {
        Identity submitter = accountDirectory.require(accountId);
        FieldChanges changes = request == null ? FieldChanges.none() : request.toChanges();
        return ResponseEntity.ok(toResponse(submissionService.submit(certId, changes, submitter)));
    }

    @PostMapping("/{certId}/reextract")
    @Operation(summary = "Run recognition again on the stored upload",
            description = "Fields the submitter already confirmed are kept.")
    public ResponseEntity<IngestionResponse> reextract(@RequestHeader(ACCOUNT_HEADER) String accountId,
                                                       @PathVariable Long certId) {
        Identity submitter = accountDirectory.require(accountId);
        return ResponseEntity.ok(IngestionResponse.from(ingestionService.reextract(certId, submitter)));
    }

    private CertificateResponse toResponse(CertificateRecord record) {
        return CertificateResponse.from(record, submissionService.missingRequiredFields(record));
    }

    private byte[] readBytes(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Certificate file is required");
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded file", ex);
        }
    }
}
