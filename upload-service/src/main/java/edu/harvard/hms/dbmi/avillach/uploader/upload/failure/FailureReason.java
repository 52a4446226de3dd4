package edu.harvard.hms.dbmi.avillach.uploader.upload.failure;

/**
 * Why an upload attempt ended without uploading. Stable names, they show up in logs.
 */
public enum FailureReason {
    INVALID_DIRECTORY("Run directory is missing required files", false),
    STATUS_UNREADABLE("Status file could not be read", false),
    STATUS_WRITE_FAILED("Status file could not be written", false),
    DIRECTORY_ERROR("Sample sheet or data directory not usable", true),
    OFFLINE_VALIDATION_FAILED("Sample sheet or sequence files are not valid", true),
    CONNECTION_FAILED("Could not connect to the sample service", false),
    CONNECTION_LOST("Lost connection to the sample service during validation", false),
    REMOTE_VALIDATION_FAILED("Sample service will not accept the run", true),
    UPLOAD_FAILED("Lost connection to the sample service during upload", false);

    private final String description;
    private final boolean marksDirectoryError;

    FailureReason(String description, boolean marksDirectoryError) {
        this.description = description;
        this.marksDirectoryError = marksDirectoryError;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true when the run itself is at fault and the directory is marked ERROR; session
     * level failures leave the directory as it was so the run is retried
     */
    public boolean marksDirectoryError() {
        return marksDirectoryError;
    }
}
