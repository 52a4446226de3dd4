package edu.harvard.hms.dbmi.avillach.uploader.progress;

import java.nio.file.Path;

/**
 * A candidate run directory as seen by a scan.
 *
 * @param directory            the run directory
 * @param requiredFilesPresent false when any platform required file is missing
 * @param status               INVALID when required files are missing, otherwise the marker status
 * @param message              detail for INVALID or unreadable markers, may be null
 */
public record RunDirectory(
    Path directory,
    boolean requiredFilesPresent,
    DirectoryStatus status,
    String message
) {
    public boolean isNew() {
        return requiredFilesPresent && status == DirectoryStatus.NEW;
    }
}
