package edu.harvard.hms.dbmi.avillach.uploader.validation;

/**
 * Stable enumeration of the kinds of problems a run directory can have.
 */
public enum ErrorKind {
    DIRECTORY("Run directory unreadable or missing required content"),
    SAMPLE_SHEET("Sample sheet malformed"),
    SEQUENCE_FILE("Sequence files for a sample could not be resolved"),
    DUPLICATE_SAMPLE("Sample identifier repeated within a project"),
    REMOTE_REJECTED("Run rejected by the sample management service");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
