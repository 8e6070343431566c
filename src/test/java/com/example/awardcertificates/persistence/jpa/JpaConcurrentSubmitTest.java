package com.example.awardcertificates.persistence.jpa;

import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.exception.StateException.Kind;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.CertificateRecord;
import com.example.awardcertificates.model.CertificateStatus;
import com.example.awardcertificates.model.FieldChanges;
import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.model.UploadedFile;
import com.example.awardcertificates.persistence.PersistenceGateway;
import com.example.awardcertificates.service.submission.SubmissionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.awardcertificates.support.TestIdentities.TEACHER;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaConcurrentSubmitTest {

    @Autowired
    private PersistenceGateway gateway;

    @Autowired
    private SubmissionService submissionService;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void onlyOneOfTwoSimultaneousSubmitsIsStored() throws Exception {
        assertThat(gateway).isInstanceOf(JpaPersistenceGateway.class);
        UploadedFile upload = gateway.saveUploadedFile(new UploadedFile(null, TEACHER.accountId(), "award.png",
                "/uploads/20261017/award.png", SourceFormat.PNG, 512, LocalDateTime.of(2026, 10, 17, 9, 0)));
        CertificateRecord draft = submissionService.createDraft(CertificateRecord.builder()
                .submitter(TEACHER)
                .set(CertificateField.STUDENT_ID, "2024010101001")
                .set(CertificateField.STUDENT_NAME, "张三")
                .set(CertificateField.COMPETITION_NAME, "全国大学生数学竞赛")
                .set(CertificateField.ADVISOR, TEACHER.displayName())
                .file(upload)
                .build());

        executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CertificateRecord>> futures = new ArrayList<>();
        for (String level : List.of("一等奖", "二等奖")) {
            Callable<CertificateRecord> submit = () -> {
                start.await();
                return submissionService.submit(draft.certId(),
                        FieldChanges.of(Map.of(CertificateField.AWARD_LEVEL, level)), TEACHER);
            };
            futures.add(executor.submit(submit));
        }
        start.countDown();

        List<CertificateRecord> accepted = new ArrayList<>();
        for (Future<CertificateRecord> future : futures) {
            try {
                accepted.add(future.get(10, TimeUnit.SECONDS));
            } catch (ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOfSatisfying(StateException.class,
                        state -> assertThat(state.getKind()).isIn(Kind.CONFLICT, Kind.INVALID_TRANSITION));
            }
        }

        assertThat(accepted).hasSize(1);
        CertificateRecord stored = gateway.getCertificate(draft.certId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(CertificateStatus.SUBMITTED);
        assertThat(stored.awardLevel()).isEqualTo(accepted.get(0).awardLevel());
    }
}
