package edu.harvard.hms.dbmi.avillach.uploader.exception;

import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationError;

import java.nio.file.Path;

/**
 * Thrown when a run directory cannot be read or written, or lacks content it must have.
 */
public class DirectoryException extends Exception {

	private static final long serialVersionUID = 4107396126571095361L;

	private final Path directory;

	public DirectoryException(String message, Path directory) {
		super(message);
		this.directory = directory;
	}

	public DirectoryException(String message, Path directory, Throwable cause) {
		super(message, cause);
		this.directory = directory;
	}

	public Path getDirectory() {
		return directory;
	}

	public ValidationError toValidationError() {
		return new ValidationError(ErrorKind.DIRECTORY, getMessage(), directory == null ? null : directory.toString());
	}
}
