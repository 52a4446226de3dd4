package edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SampleResource(String identifier, String sampleName, String description) {
}
