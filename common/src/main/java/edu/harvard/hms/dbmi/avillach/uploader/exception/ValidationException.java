package edu.harvard.hms.dbmi.avillach.uploader.exception;

import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;

/**
 * Raised once a stage has decided to stop, carrying every error the stage accumulated.
 */
public class ValidationException extends Exception {

	private static final long serialVersionUID = 7431092280416653107L;

	private final ValidationResult result;

	public ValidationException(String message, ValidationResult result) {
		super(message);
		this.result = result;
	}

	public ValidationResult getResult() {
		return result;
	}
}
