package edu.harvard.hms.dbmi.avillach.uploader.upload.config;

import edu.harvard.hms.dbmi.avillach.uploader.parser.ParserType;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSettings;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the uploader.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "uploader.*" prefix.
 */
@ConfigurationProperties(prefix = "uploader")
@Validated
public class UploaderConfig {
    private static final Logger log = LoggerFactory.getLogger(UploaderConfig.class);

    // Required properties
    private String directory;
    private String baseUrl;
    private String clientId;
    private String username;
    private String password;

    // Optional properties with defaults
    private String clientSecret;
    private UploadMode mode = UploadMode.SINGLE;
    private ParserType parser = ParserType.NEXTSEQ;
    private boolean force = false;
    private int timeoutSeconds = 600; // large files over slow links

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (directory == null || directory.isBlank()) {
            errors.add("uploader.directory is required");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            errors.add("uploader.base-url is required");
        }
        if (clientId == null || clientId.isBlank()) {
            errors.add("uploader.client-id is required");
        }
        if (username == null || username.isBlank()) {
            errors.add("uploader.username is required");
        }
        if (password == null || password.isBlank()) {
            errors.add("uploader.password is required");
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Missing required configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        Path directoryPath = Path.of(directory);
        if (!Files.exists(directoryPath)) {
            errors.add("Directory not found: " + directory);
        } else if (!Files.isDirectory(directoryPath)) {
            errors.add("Directory path is not a directory: " + directory);
        }

        try {
            URI uri = URI.create(baseUrl);
            if (uri.getScheme() == null || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
                errors.add("Base URL must be an http or https URL: " + baseUrl);
            }
        } catch (IllegalArgumentException e) {
            errors.add("Base URL is malformed: " + baseUrl + " - " + e.getMessage());
        }

        if (timeoutSeconds <= 0) {
            errors.add("uploader.timeout-seconds must be positive, was " + timeoutSeconds);
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Directory: {}", directory);
        log.info("Mode: {}", mode);
        log.info("Parser: {}", parser);
        log.info("Force re-upload: {}", force);
        log.info("Sample service: {} (client {}, user {})", baseUrl, clientId, username);
        log.info("Timeout: {} seconds", timeoutSeconds);
        log.info("================================");
    }

    public ApiSettings toApiSettings() {
        return new ApiSettings(baseUrl, clientId, clientSecret, username, password, Duration.ofSeconds(timeoutSeconds));
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public UploadMode getMode() {
        return mode;
    }

    public void setMode(UploadMode mode) {
        this.mode = mode;
    }

    public ParserType getParser() {
        return parser;
    }

    public void setParser(ParserType parser) {
        this.parser = parser;
    }

    public boolean isForce() {
        return force;
    }

    public void setForce(boolean force) {
        this.force = force;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
