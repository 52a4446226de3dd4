package edu.harvard.hms.dbmi.avillach.uploader.exception;

import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationError;

/**
 * Thrown when the sequence files of a sample cannot be resolved: no match, a missing mate of a
 * read pair, or a file whose read direction cannot be told.
 */
public class SequenceFileException extends Exception {

	private static final long serialVersionUID = 2934556103278811872L;

	private final String sampleName;

	public SequenceFileException(String message, String sampleName) {
		super(message);
		this.sampleName = sampleName;
	}

	public String getSampleName() {
		return sampleName;
	}

	public ValidationError toValidationError() {
		return new ValidationError(ErrorKind.SEQUENCE_FILE, getMessage(), sampleName);
	}
}
