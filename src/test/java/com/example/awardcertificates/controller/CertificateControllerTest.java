package com.example.awardcertificates.controller;

import com.example.awardcertificates.config.ClockConfiguration;
import com.example.awardcertificates.exception.ExtractionException;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.ReconciliationException;
import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.Deadline;
import com.example.awardcertificates.model.ExtractionStatus;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.service.identity.AccountDirectory;
import com.example.awardcertificates.service.ingestion.CertificateIngestionService;
import com.example.awardcertificates.service.ingestion.IngestionResult;
import com.example.awardcertificates.service.submission.SubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static com.example.awardcertificates.support.TestIdentities.ADMIN;
import static com.example.awardcertificates.support.TestIdentities.STUDENT;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {CertificateController.class, DeadlineController.class, AdminCertificateController.class})
@Import(ClockConfiguration.class)
class CertificateControllerTest {

    private static final String HEADER = "X-Account-Id";
    private static final LocalDateTime CREATED = LocalDateTime.of(2026, 10, 17, 10, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CertificateIngestionService ingestionService;

    @MockBean
    private SubmissionService submissionService;

    @MockBean
    private AccountDirectory accountDirectory;

    @BeforeEach
    void setUp() {
        when(accountDirectory.require(STUDENT.accountId())).thenReturn(STUDENT);
        when(accountDirectory.require(ADMIN.accountId())).thenReturn(ADMIN);
        when(accountDirectory.require("nobody")).thenThrow(StateException.forbidden(null, "Unknown account 'nobody'"));
        when(submissionService.missingRequiredFields(any())).thenReturn(List.of());
    }

    @Test
    void uploadReturnsCreatedDraftWithMissingFields() throws Exception {
        when(ingestionService.ingest(any(byte[].class), eq("award.png"), eq(MediaType.IMAGE_PNG_VALUE), eq(STUDENT)))
                .thenReturn(new IngestionResult(draft(), ExtractionStatus.PARTIAL, null,
                        List.of(CertificateField.ADVISOR)));

        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.png", MediaType.IMAGE_PNG_VALUE, new byte[]{1, 2}))
                        .header(HEADER, STUDENT.accountId()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.certificate.certId").value(42))
                .andExpect(jsonPath("$.certificate.status").value("draft"))
                .andExpect(jsonPath("$.certificate.fields.student_id").value("2024010101001"))
                .andExpect(jsonPath("$.certificate.fields.competition_name").value("全国大学生数学竞赛"))
                .andExpect(jsonPath("$.certificate.missingRequiredFields[0]").value("advisor"))
                .andExpect(jsonPath("$.extractionStatus").value("PARTIAL"));
    }

    @Test
    void uploadRequiresAccountHeader() throws Exception {
        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.png", MediaType.IMAGE_PNG_VALUE, new byte[]{1})))
                .andExpect(status().isBadRequest());
    }

    @Test
    void uploadFromUnknownAccountIsForbidden() throws Exception {
        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.png", MediaType.IMAGE_PNG_VALUE, new byte[]{1}))
                        .header(HEADER, "nobody"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void unsupportedUploadIsBadRequest() throws Exception {
        when(ingestionService.ingest(any(byte[].class), anyString(), any(), eq(STUDENT)))
                .thenThrow(new FormatException(FormatException.Kind.UNSUPPORTED_FORMAT, "File 'award.gif' is not accepted"));

        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.gif", "image/gif", new byte[]{1}))
                        .header(HEADER, STUDENT.accountId()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_FORMAT"))
                .andExpect(jsonPath("$.path").value("/api/v1/certificates"));
    }

    @Test
    void missingPdfRendererIsServiceUnavailable() throws Exception {
        when(ingestionService.ingest(any(byte[].class), anyString(), any(), eq(STUDENT)))
                .thenThrow(new FormatException(FormatException.Kind.CONVERSION_TOOL_UNAVAILABLE, "No renderer"));

        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.pdf", "application/pdf", new byte[]{1}))
                        .header(HEADER, STUDENT.accountId()))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void failedExtractionIsBadGateway() throws Exception {
        when(ingestionService.ingest(any(byte[].class), anyString(), any(), eq(STUDENT)))
                .thenThrow(new ExtractionException("Recognition service unreachable", true));

        mockMvc.perform(multipart("/api/v1/certificates")
                        .file(new MockMultipartFile("file", "award.jpg", MediaType.IMAGE_JPEG_VALUE, new byte[]{1}))
                        .header(HEADER, STUDENT.accountId()))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("EXTRACTION_FAILED"));
    }

    @Test
    void submitWithMissingAdvisorIsUnprocessable() throws Exception {
        when(submissionService.submit(eq(42L), any(FieldChanges.class), eq(STUDENT)))
                .thenThrow(new StateException(StateException.Kind.MISSING_REQUIRED_FIELDS,
                        "Required fields are missing: 指导教师 (advisor)", 42L, CertificateStatus.DRAFT, null,
                        List.of(CertificateField.ADVISOR)));

        mockMvc.perform(post("/api/v1/certificates/42/submit").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("MISSING_REQUIRED_FIELDS"))
                .andExpect(jsonPath("$.fields[0]").value("advisor"));
    }

    @Test
    void submitPassesFinalChanges() throws Exception {
        CertificateRecord submitted = draft().toBuilder()
                .set(CertificateField.ADVISOR, "李老师")
                .status(CertificateStatus.SUBMITTED)
                .submittedAt(CREATED.plusHours(1))
                .build();
        when(submissionService.submit(eq(42L), any(FieldChanges.class), eq(STUDENT))).thenReturn(submitted);

        mockMvc.perform(post("/api/v1/certificates/42/submit")
                        .header(HEADER, STUDENT.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"advisor\": \"李老师\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("submitted"))
                .andExpect(jsonPath("$.fields.advisor").value("李老师"));

        verify(submissionService).submit(eq(42L),
                argThat(changes -> changes.value(CertificateField.ADVISOR).orElse("").equals("李老师")), eq(STUDENT));
    }

    @Test
    void submitAfterDeadlineIsUnprocessable() throws Exception {
        when(submissionService.submit(eq(42L), any(FieldChanges.class), eq(STUDENT)))
                .thenThrow(new StateException(StateException.Kind.DEADLINE_PASSED, "The submission deadline has passed",
                        42L, CertificateStatus.DRAFT, new Deadline(CREATED), null));

        mockMvc.perform(post("/api/v1/certificates/42/submit").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DEADLINE_PASSED"));
    }

    @Test
    void editingSubmittedCertificateIsConflict() throws Exception {
        when(submissionService.edit(eq(42L), any(FieldChanges.class), eq(STUDENT)))
                .thenThrow(new StateException(StateException.Kind.RECORD_IMMUTABLE,
                        "Submitted certificates can no longer be changed", 42L, CertificateStatus.SUBMITTED, null, null));

        mockMvc.perform(patch("/api/v1/certificates/42")
                        .header(HEADER, STUDENT.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"award_level\": \"特等奖\"}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RECORD_IMMUTABLE"));
    }

    @Test
    void changingAccountOwnedFieldIsBadRequest() throws Exception {
        when(submissionService.save(eq(42L), any(FieldChanges.class), eq(STUDENT)))
                .thenThrow(new ReconciliationException("Fields [student_id] are taken from the student account",
                        List.of(CertificateField.STUDENT_ID)));

        mockMvc.perform(put("/api/v1/certificates/42")
                        .header(HEADER, STUDENT.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"student_id\": \"2024010101009\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields[0]").value("student_id"));
    }

    @Test
    void unknownFieldNameIsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/v1/certificates/42")
                        .header(HEADER, STUDENT.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"prize_money\": \"500\"}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void certificateOfAnotherAccountIsForbiddenAndUnknownIsNotFound() throws Exception {
        when(submissionService.getCertificate(42L, STUDENT))
                .thenThrow(StateException.forbidden(42L, "Certificate 42 belongs to another account"));
        when(submissionService.getCertificate(404L, STUDENT)).thenThrow(StateException.notFound(404L));

        mockMvc.perform(get("/api/v1/certificates/42").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/certificates/404").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersByStatus() throws Exception {
        when(submissionService.listCertificates(STUDENT, CertificateStatus.DRAFT)).thenReturn(List.of(draft()));

        mockMvc.perform(get("/api/v1/certificates").param("status", "draft").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].certId").value(42));
        mockMvc.perform(get("/api/v1/certificates").param("status", "archived").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deadlineIsPublic() throws Exception {
        when(submissionService.currentDeadline()).thenReturn(new Deadline(LocalDateTime.of(2099, 12, 31, 23, 59, 59)));

        mockMvc.perform(get("/api/v1/deadline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deadline").value("2099-12-31T23:59:59"))
                .andExpect(jsonPath("$.open").value(true));
    }

    @Test
    void administratorMovesDeadline() throws Exception {
        LocalDateTime moved = LocalDateTime.of(2099, 1, 15, 18, 0);
        when(submissionService.updateDeadline(moved, ADMIN)).thenReturn(new Deadline(moved));

        mockMvc.perform(put("/api/v1/admin/deadline")
                        .header(HEADER, ADMIN.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deadline\": \"2099-01-15T18:00:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deadline").value("2099-01-15T18:00:00"));
    }

    @Test
    void deadlineRequestNeedsTimestamp() throws Exception {
        mockMvc.perform(put("/api/v1/admin/deadline")
                        .header(HEADER, ADMIN.accountId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void administratorDeletesCertificate() throws Exception {
        mockMvc.perform(delete("/api/v1/admin/certificates/42").header(HEADER, ADMIN.accountId()))
                .andExpect(status().isNoContent());

        verify(submissionService).adminDelete(42L, ADMIN);
    }

    @Test
    void studentCannotDeleteCertificate() throws Exception {
        doThrow(StateException.forbidden(42L, "Administrator role required"))
                .when(submissionService).adminDelete(42L, STUDENT);

        mockMvc.perform(delete("/api/v1/admin/certificates/42").header(HEADER, STUDENT.accountId()))
                .andExpect(status().isForbidden());
    }

    private static CertificateRecord draft() {
        return CertificateRecord.builder()
                .certId(42L)
                .submitter(STUDENT)
                .set(CertificateField.STUDENT_ID, STUDENT.accountId())
                .set(CertificateField.STUDENT_NAME, STUDENT.displayName())
                .set(CertificateField.COMPETITION_NAME, "全国大学生数学竞赛")
                .set(CertificateField.AWARD_LEVEL, "一等奖")
                .fileId(7L)
                .extractionMethod("glm-4v-plus-0111")
                .createdAt(CREATED)
                .build();
    }
}
