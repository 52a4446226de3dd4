package edu.harvard.hms.dbmi.avillach.uploader.progress;

import java.util.Locale;

/**
 * Upload state of a run directory.
 *
 * NEW is implied by the absence of a marker and INVALID is derived from missing required files,
 * so neither is ever written to disk.
 */
public enum DirectoryStatus {
    NEW(false),
    PARTIAL(true),
    COMPLETE(true),
    ERROR(true),
    INVALID(false);

    private final boolean persistable;

    DirectoryStatus(boolean persistable) {
        this.persistable = persistable;
    }

    public boolean isPersistable() {
        return persistable;
    }

    /**
     * @return the token stored in the status marker
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the token does not name a status
     */
    public static DirectoryStatus fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Status token is missing");
        }
        return DirectoryStatus.valueOf(token.trim().toUpperCase(Locale.ROOT));
    }
}
