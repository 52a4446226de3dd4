package edu.harvard.hms.dbmi.avillach.uploader.upload.api;

import java.time.Duration;

/**
 * Where the sample service lives and how to log in to it.
 */
public record ApiSettings(
    String baseUrl,
    String clientId,
    String clientSecret,
    String username,
    String password,
    Duration timeout
) {
    @Override
    public String toString() {
        return "ApiSettings{baseUrl=" + baseUrl + ", clientId=" + clientId + ", username=" + username + ", timeout=" + timeout + "}";
    }
}
