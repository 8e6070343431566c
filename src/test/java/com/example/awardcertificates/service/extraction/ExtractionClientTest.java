package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.config.RecognitionConfiguration;
import com.example.awardcertificates.model.CanonicalImage;
import com.example.awardcertificates.model.CertificateField;
import com.example.awardcertificates.model.ExtractionResult;
import com.example.awardcertificates.model.ExtractionStatus;
import com.example.awardcertificates.model.SourceFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExtractionClientTest {

    private static final CanonicalImage IMAGE = new CanonicalImage(new byte[]{1, 2, 3}, 10, 10, SourceFormat.PNG, 1);

    private VisionRecognitionService recognitionService;
    private ExtractionClient client;

    @BeforeEach
    void setUp() {
        CertificateProperties.Recognition recognition = new CertificateProperties().getRecognition();
        recognition.setMaxAttempts(3);
        recognition.setInitialBackoff(Duration.ofMillis(1));
        recognitionService = mock(VisionRecognitionService.class);
        client = new ExtractionClient(recognitionService, new ExtractionResponseParser(new ObjectMapper()),
                RecognitionConfiguration.buildRetry(recognition));
    }

    @Test
    void shouldSendCanonicalImageWithSchemaPrompt() {
        when(recognitionService.recognize(any(), anyString())).thenReturn("{\"award_level\": \"一等奖\"}");

        ExtractionResult result = client.extract(IMAGE);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(recognitionService).recognize(eq(IMAGE), prompt.capture());
        assertThat(prompt.getValue()).contains("student_id", "award_level", "advisor");
        assertThat(result.value(CertificateField.AWARD_LEVEL)).contains("一等奖");
    }

    @Test
    void shouldRetryTransientFailures() {
        when(recognitionService.recognize(any(), anyString()))
                .thenThrow(new RecognitionCallException("Recognition service responded 503", true))
                .thenReturn("{\"organizer\": \"中国数学会\"}");

        ExtractionResult result = client.extract(IMAGE);

        assertThat(result.status()).isEqualTo(ExtractionStatus.PARTIAL);
        assertThat(result.value(CertificateField.ORGANIZER)).contains("中国数学会");
        verify(recognitionService, times(2)).recognize(any(), anyString());
    }

    @Test
    void shouldReturnFailedAfterRetriesAreExhausted() {
        when(recognitionService.recognize(any(), anyString()))
                .thenThrow(new RecognitionCallException("Recognition service unreachable", true));

        ExtractionResult result = client.extract(IMAGE);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.fields()).isEmpty();
        assertThat(result.notes()).contains("unreachable");
        verify(recognitionService, times(3)).recognize(any(), anyString());
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        when(recognitionService.recognize(any(), anyString()))
                .thenThrow(new RecognitionCallException("Recognition service responded 401", false));

        ExtractionResult result = client.extract(IMAGE);

        assertThat(result.isFailed()).isTrue();
        verify(recognitionService, times(1)).recognize(any(), anyString());
    }

    @Test
    void shouldReportModelAsExtractionMethod() {
        when(recognitionService.modelName()).thenReturn("glm-4v-plus-0111");

        assertThat(client.extractionMethod()).isEqualTo("glm-4v-plus-0111");
    }
}
