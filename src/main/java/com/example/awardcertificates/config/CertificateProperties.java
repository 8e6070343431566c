package com.example.awardcertificates.config;

import com.example.awardcertificates.model.Role;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "certificates")
public class CertificateProperties {

    private final Upload upload = new Upload();
    private final Normalization normalization = new Normalization();
    private final Recognition recognition = new Recognition();
    private final Deadline deadline = new Deadline();
    private final Persistence persistence = new Persistence();
    private List<Account> accounts = new ArrayList<>();

    public Upload getUpload() {
        return upload;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public Recognition getRecognition() {
        return recognition;
    }

    public Deadline getDeadline() {
        return deadline;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts;
    }

    public static class Upload {

        private String directory = "uploads";
        private DataSize maxFileSize = DataSize.ofMegabytes(10);
        private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "jpg", "jpeg", "png", "bmp"));

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public DataSize getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(DataSize maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }
    }

    public static class Normalization {

        private int maxDimension = 2048;
        private float renderDpi = 200f;

        public int getMaxDimension() {
            return maxDimension;
        }

        public void setMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
        }

        public float getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(float renderDpi) {
            this.renderDpi = renderDpi;
        }
    }

    public static class Recognition {

        /**
         * {@code remote} calls the vision API, {@code fixture} replays {@link #fixtureResponse}.
         */
        private String mode = "remote";
        private String baseUrl = "https://open.bigmodel.cn/api/paas/v4";
        private String apiKey;
        private String model = "glm-4v-plus-0111";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private String fixtureResponse = "{}";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public String getFixtureResponse() {
            return fixtureResponse;
        }

        public void setFixtureResponse(String fixtureResponse) {
            this.fixtureResponse = fixtureResponse;
        }
    }

    public static class Deadline {

        private LocalDateTime defaultValue = LocalDateTime.of(2026, 12, 31, 23, 59, 59);

        public LocalDateTime getDefaultValue() {
            return defaultValue;
        }

        public void setDefaultValue(LocalDateTime defaultValue) {
            this.defaultValue = defaultValue;
        }
    }

    public static class Persistence {

        private String mode = "jpa";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Account {

        private String accountId;
        private String displayName;
        private Role role;
        private String department;

        public String getAccountId() {
            return accountId;
        }

        public void setAccountId(String accountId) {
            this.accountId = accountId;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public Role getRole() {
            return role;
        }

        public void setRole(Role role) {
            this.role = role;
        }

        public String getDepartment() {
            return department;
        }

        public void setDepartment(String department) {
            this.department = department;
        }
    }
}
