package edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SequencingRunResource(String identifier, String uploadStatus) {
}
