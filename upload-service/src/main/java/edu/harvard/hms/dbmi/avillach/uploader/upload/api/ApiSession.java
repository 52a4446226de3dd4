package edu.harvard.hms.dbmi.avillach.uploader.upload.api;

import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;

/**
 * An authenticated conversation with the sample service.
 */
public interface ApiSession {

    /**
     * Checks the run against remote state, e.g. that every project exists and can be written to.
     * A run the service will not take is reported in the result, not thrown.
     *
     * @throws ApiConnectionException if the service could not be asked
     */
    ValidationResult validateForUpload(SequencingRun run) throws ApiConnectionException;

    /**
     * Sends every sample's files, creating samples the service does not know yet.
     *
     * @throws ApiConnectionException on the first request that fails; earlier files stay uploaded
     */
    void uploadSequencingRun(SequencingRun run) throws ApiConnectionException;
}
