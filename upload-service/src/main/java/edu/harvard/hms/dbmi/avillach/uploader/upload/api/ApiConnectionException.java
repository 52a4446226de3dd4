package edu.harvard.hms.dbmi.avillach.uploader.upload.api;

/**
 * The sample service could not be reached, refused our credentials or failed mid-request. Unlike
 * a rejected run this says nothing about the run itself.
 */
public class ApiConnectionException extends Exception {

	private static final long serialVersionUID = 7719485620337102315L;

	public ApiConnectionException(String message) {
		super(message);
	}

	public ApiConnectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
