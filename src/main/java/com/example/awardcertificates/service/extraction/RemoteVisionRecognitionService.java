package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.model.CanonicalImage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Calls a GLM-4V compatible chat-completions endpoint with the certificate
 * image and extraction prompt.
 */
public class RemoteVisionRecognitionService implements VisionRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(RemoteVisionRecognitionService.class);
    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;

    public RemoteVisionRecognitionService(RestTemplate restTemplate, ObjectMapper objectMapper,
                                          CertificateProperties.Recognition properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = stripTrailingSlash(properties.getBaseUrl()) + COMPLETIONS_PATH;
        this.apiKey = properties.getApiKey();
        this.model = properties.getModel();
    }

    @Override
    public String recognize(CanonicalImage image, String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new RecognitionCallException("Recognition API key is not configured", false);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(apiKey);

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of(
                        "role", "user",
                        "content", List.of(
                                Map.of("type", "image_url",
                                        "image_url", Map.of("url", Base64.getEncoder().encodeToString(image.png()))),
                                Map.of("type", "text", "text", prompt)))));

        String response;
        try {
            response = restTemplate.postForObject(endpoint, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException ex) {
            HttpStatusCode status = ex.getStatusCode();
            boolean retryable = isRetryable(status);
            throw new RecognitionCallException("Recognition service responded " + status.value()
                    + (retryable ? "" : ": " + ex.getResponseBodyAsString()), retryable, ex);
        } catch (ResourceAccessException ex) {
            throw new RecognitionCallException("Recognition service unreachable: " + ex.getMessage(), true, ex);
        } catch (RestClientException ex) {
            throw new RecognitionCallException("Recognition request rejected: " + ex.getMessage(), false, ex);
        }
        return extractContent(response);
    }

    @Override
    public String modelName() {
        return model;
    }

    private String extractContent(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        try {
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            if (content.isTextual()) {
                return content.asText();
            }
            log.warn("Recognition reply carried no message content; passing the raw body to the parser");
        } catch (JsonProcessingException ex) {
            log.warn("Recognition reply envelope is not JSON; passing the raw body to the parser");
        }
        return response;
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()
                || status.value() == HttpStatus.REQUEST_TIMEOUT.value();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            throw new IllegalStateException("certificates.recognition.base-url must be set");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
