package edu.harvard.hms.dbmi.avillach.uploader.validation;

/**
 * A single problem found while validating a run.
 *
 * @param kind    what class of problem this is
 * @param message human readable detail
 * @param entity  the offending entity (directory, sheet line, sample or project name), may be null
 */
public record ValidationError(ErrorKind kind, String message, String entity) {

    public ValidationError {
        if (kind == null) {
            throw new IllegalArgumentException("Validation error kind is required");
        }
    }

    @Override
    public String toString() {
        return entity == null ? kind + ": " + message : kind + " [" + entity + "]: " + message;
    }
}
