package edu.harvard.hms.dbmi.avillach.uploader.upload;

/**
 * Stages of one upload attempt, in order.
 */
public enum UploadStage {
    START,
    STATUS_WRITTEN,
    PARSED,
    OFFLINE_VALID,
    CONNECTED,
    ONLINE_VALID,
    UPLOADED,
    DONE
}
