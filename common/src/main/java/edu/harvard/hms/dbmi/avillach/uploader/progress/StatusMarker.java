package edu.harvard.hms.dbmi.avillach.uploader.progress;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * JSON content of the status marker file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusMarker(
    String status,
    Instant timestamp,
    String message
) {
}
