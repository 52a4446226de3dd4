package edu.harvard.hms.dbmi.avillach.uploader.upload.config;

/**
 * What {@code uploader.directory} points at.
 */
public enum UploadMode {
    /** a single run directory */
    SINGLE,
    /** a directory of runs; upload the first new one */
    FIRST_NEW,
    /** a directory of runs; upload every new one */
    BATCH
}
