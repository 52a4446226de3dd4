package edu.harvard.hms.dbmi.avillach.uploader.upload.api;

/**
 * Entry point to the remote sample-management service.
 */
public interface SampleServiceApi {

    /**
     * Logs in and returns a session bound to the authenticated user.
     *
     * @throws ApiConnectionException if the service is unreachable or rejects the credentials
     */
    ApiSession connect(ApiSettings settings) throws ApiConnectionException;
}
