package edu.harvard.hms.dbmi.avillach.uploader.exception;

import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationError;

import java.nio.file.Path;

/**
 * Thrown when the metadata section of a sample sheet cannot be parsed. Carries the offending
 * line so the problem can be fixed without re-running the parser.
 */
public class SampleSheetException extends Exception {

	private static final long serialVersionUID = -6321882404460329411L;

	private final Path sampleSheet;
	private final long lineNumber;
	private final String line;

	public SampleSheetException(String message, Path sampleSheet, long lineNumber, String line) {
		super(message);
		this.sampleSheet = sampleSheet;
		this.lineNumber = lineNumber;
		this.line = line;
	}

	public SampleSheetException(String message, Path sampleSheet) {
		this(message, sampleSheet, -1, null);
	}

	public Path getSampleSheet() {
		return sampleSheet;
	}

	/**
	 * @return 1-based line number in the sheet, or -1 when the problem is not tied to one line
	 */
	public long getLineNumber() {
		return lineNumber;
	}

	public String getLine() {
		return line;
	}

	public ValidationError toValidationError() {
		String entity = lineNumber < 0 ? String.valueOf(sampleSheet) : sampleSheet + ":" + lineNumber + " '" + line + "'";
		return new ValidationError(ErrorKind.SAMPLE_SHEET, getMessage(), entity);
	}
}
