package com.example.awardcertificates.service.ingestion;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.config.RecognitionConfiguration;
import com.example.awardcertificates.exception.ExtractionException;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.CanonicalImage;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.ExtractionStatus;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.persistence.InMemoryPersistenceGateway;
import com.example.awardcertificates.service.extraction.ExtractionClient;
import com.example.awardcertificates.service.extraction.ExtractionResponseParser;
import com.example.awardcertificates.service.extraction.RecognitionCallException;
import com.example.awardcertificates.service.extraction.VisionRecognitionService;
import com.example.awardcertificates.service.normalization.FormatNormalizer;
import com.example.awardcertificates.service.normalization.PdfBoxDocumentRenderer;
import com.example.awardcertificates.service.reconciliation.FieldReconciler;
import com.example.awardcertificates.service.storage.UploadStorage;
import com.example.awardcertificates.service.submission.SubmissionService;
import com.example.awardcertificates.service.submission.SubmissionStateMachine;
import com.example.awardcertificates.support.MutableClock;
import com.example.awardcertificates.support.TestDocuments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Stream;

import static com.example.awardcertificates.support.TestIdentities.OTHER_STUDENT;
import static com.example.awardcertificates.support.TestIdentities.STUDENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CertificateIngestionServiceTest {

    private static final LocalDateTime DEADLINE = LocalDateTime.of(2026, 12, 31, 23, 59, 59);
    private static final String REPLY = """
            ```json
            {"student_id": "2024010101001", "student_name": "张三", "competition_name": "全国大学生数学竞赛",
             "award_level": "一等奖", "award_date": "2024年5月20日", "advisor": null}
            ```
            """;

    @TempDir
    Path uploadRoot;

    private MutableClock clock;
    private InMemoryPersistenceGateway gateway;
    private VisionRecognitionService recognitionService;
    private SubmissionService submissionService;
    private CertificateIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        CertificateProperties properties = new CertificateProperties();
        properties.getUpload().setDirectory(uploadRoot.toString());
        properties.getNormalization().setRenderDpi(72f);
        properties.getDeadline().setDefaultValue(DEADLINE);
        properties.getRecognition().setMaxAttempts(2);
        properties.getRecognition().setInitialBackoff(Duration.ofMillis(1));

        clock = new MutableClock(DEADLINE.minusDays(3));
        gateway = new InMemoryPersistenceGateway(properties);
        recognitionService = mock(VisionRecognitionService.class);
        when(recognitionService.modelName()).thenReturn("glm-4v-plus-0111");

        FieldReconciler reconciler = new FieldReconciler();
        submissionService = new SubmissionService(gateway, new SubmissionStateMachine(), reconciler, clock);
        ExtractionClient extractionClient = new ExtractionClient(recognitionService,
                new ExtractionResponseParser(new ObjectMapper()),
                RecognitionConfiguration.buildRetry(properties.getRecognition()));
        ingestionService = new CertificateIngestionService(
                new UploadStorage(properties, clock),
                new FormatNormalizer(new PdfBoxDocumentRenderer(properties), properties),
                extractionClient,
                reconciler,
                submissionService,
                gateway);
    }

    @Test
    void shouldCreateDraftFromStudentUpload() {
        when(recognitionService.recognize(any(), anyString())).thenReturn(REPLY);

        IngestionResult result = ingestionService.ingest(TestDocuments.image("jpg", 800, 600, Color.WHITE),
                "award.jpg", "image/jpeg", STUDENT);

        CertificateRecord draft = result.certificate();
        assertThat(result.extractionStatus()).isEqualTo(ExtractionStatus.PARTIAL);
        assertThat(draft.certId()).isNotNull();
        assertThat(draft.studentId()).isEqualTo("2024010101001");
        assertThat(draft.studentName()).isEqualTo("张三");
        assertThat(draft.competitionName()).isEqualTo("全国大学生数学竞赛");
        assertThat(draft.awardLevel()).isEqualTo("一等奖");
        assertThat(draft.awardDate()).isEqualTo("2024-05-20");
        assertThat(draft.advisor()).isNull();
        assertThat(draft.extractionMethod()).isEqualTo("glm-4v-plus-0111");
        assertThat(result.missingRequiredFields()).containsExactly(CertificateField.ADVISOR);
        assertThat(gateway.getUploadedFile(draft.fileId())).isPresent();
        assertThat(Files.exists(Path.of(draft.filePath()))).isTrue();

        assertThatThrownBy(() -> submissionService.submit(draft.certId(), FieldChanges.none(), STUDENT))
                .isInstanceOfSatisfying(StateException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(StateException.Kind.MISSING_REQUIRED_FIELDS));
        CertificateRecord submitted = submissionService.submit(draft.certId(),
                FieldChanges.of(Map.of(CertificateField.ADVISOR, "李老师")), STUDENT);
        assertThat(submitted.isDraft()).isFalse();
    }

    @Test
    void shouldSendOnlyFirstPageOfDocumentToRecognition() {
        when(recognitionService.recognize(any(), anyString())).thenReturn(REPLY);
        byte[] pdf = TestDocuments.pdf(Color.RED, Color.BLUE, Color.BLUE, Color.BLUE, Color.BLUE);

        ingestionService.ingest(pdf, "award.pdf", "application/pdf", STUDENT);

        ArgumentCaptor<CanonicalImage> image = ArgumentCaptor.forClass(CanonicalImage.class);
        verify(recognitionService).recognize(image.capture(), anyString());
        CanonicalImage sent = image.getValue();
        Color center = new Color(sent.toBufferedImage().getRGB(sent.width() / 2, sent.height() / 2));
        assertThat(sent.sourceFormat()).isEqualTo(SourceFormat.PDF);
        assertThat(sent.sourcePageCount()).isEqualTo(5);
        assertThat(center.getRed()).isGreaterThan(200);
        assertThat(center.getBlue()).isLessThan(60);
    }

    @Test
    void shouldKeepUploadButCreateNoDraftWhenExtractionFails() throws Exception {
        when(recognitionService.recognize(any(), anyString()))
                .thenThrow(new RecognitionCallException("Recognition service unreachable", true));

        assertThatThrownBy(() -> ingestionService.ingest(TestDocuments.image("png", 200, 100, Color.WHITE),
                "award.png", "image/png", STUDENT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("unreachable");

        assertThat(gateway.getUploadedFile(1L)).isPresent();
        assertThat(gateway.listCertificates(STUDENT.accountId(), null)).isEmpty();
        try (Stream<Path> files = Files.walk(uploadRoot)) {
            assertThat(files.filter(Files::isRegularFile).count()).isEqualTo(1);
        }
    }

    @Test
    void shouldRejectUploadAfterDeadlineBeforeAnyWork() {
        clock.set(DEADLINE.plusSeconds(1));

        assertThatThrownBy(() -> ingestionService.ingest(TestDocuments.image("png", 20, 20, Color.WHITE),
                "award.png", "image/png", STUDENT))
                .isInstanceOfSatisfying(StateException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(StateException.Kind.DEADLINE_PASSED));
        verify(recognitionService, never()).recognize(any(), anyString());
        assertThat(gateway.getUploadedFile(1L)).isEmpty();
    }

    @Test
    void shouldRejectUnreadableUploadWithoutStoringIt() {
        assertThatThrownBy(() -> ingestionService.ingest(new byte[]{1, 2, 3}, "award.png", "image/png", STUDENT))
                .isInstanceOf(FormatException.class);

        assertThat(gateway.getUploadedFile(1L)).isEmpty();
        verify(recognitionService, never()).recognize(any(), anyString());
    }

    @Test
    void shouldKeepConfirmedFieldsWhenReextracting() {
        when(recognitionService.recognize(any(), anyString()))
                .thenReturn(REPLY)
                .thenReturn("{\"award_level\": \"二等奖\", \"organizer\": \"中国数学会\", \"advisor\": \"王老师\"}");
        CertificateRecord draft = ingestionService.ingest(TestDocuments.image("png", 200, 100, Color.WHITE),
                "award.png", "image/png", STUDENT).certificate();
        submissionService.edit(draft.certId(), FieldChanges.of(Map.of(CertificateField.ADVISOR, "李老师")), STUDENT);

        IngestionResult rerun = ingestionService.reextract(draft.certId(), STUDENT);

        CertificateRecord refreshed = rerun.certificate();
        assertThat(refreshed.certId()).isEqualTo(draft.certId());
        assertThat(refreshed.advisor()).isEqualTo("李老师");
        assertThat(refreshed.awardLevel()).isEqualTo("二等奖");
        assertThat(refreshed.organizer()).isEqualTo("中国数学会");
        assertThat(refreshed.fileId()).isEqualTo(draft.fileId());
        assertThat(rerun.missingRequiredFields()).isEmpty();
    }

    @Test
    void shouldKeepValueConfirmedWhileRecognitionIsRunning() {
        when(recognitionService.recognize(any(), anyString())).thenReturn(REPLY);
        CertificateRecord draft = ingestionService.ingest(TestDocuments.image("png", 200, 100, Color.WHITE),
                "award.png", "image/png", STUDENT).certificate();
        when(recognitionService.recognize(any(), anyString())).thenAnswer(invocation -> {
            submissionService.edit(draft.certId(), FieldChanges.of(Map.of(CertificateField.ADVISOR, "李老师")),
                    STUDENT);
            return "{\"advisor\": \"王老师\", \"organizer\": \"中国数学会\"}";
        });

        CertificateRecord refreshed = ingestionService.reextract(draft.certId(), STUDENT).certificate();

        assertThat(refreshed.advisor()).isEqualTo("李老师");
        assertThat(refreshed.organizer()).isEqualTo("中国数学会");
        assertThat(refreshed.manualFields()).contains(CertificateField.ADVISOR);
        CertificateRecord stored = gateway.getCertificate(draft.certId()).orElseThrow();
        assertThat(stored.advisor()).isEqualTo("李老师");
        assertThat(stored.manualFields()).contains(CertificateField.ADVISOR);
    }

    @Test
    void shouldOnlyLetSubmitterReextract() {
        when(recognitionService.recognize(any(), anyString())).thenReturn(REPLY);
        CertificateRecord draft = ingestionService.ingest(TestDocuments.image("png", 200, 100, Color.WHITE),
                "award.png", "image/png", STUDENT).certificate();

        assertThatThrownBy(() -> ingestionService.reextract(draft.certId(), OTHER_STUDENT))
                .isInstanceOfSatisfying(StateException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(StateException.Kind.FORBIDDEN));
    }
}
