package edu.harvard.hms.dbmi.avillach.uploader.upload;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.ValidationException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.DirectoryScanner;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SampleSheetParser;
import edu.harvard.hms.dbmi.avillach.uploader.progress.DirectoryStatus;
import edu.harvard.hms.dbmi.avillach.uploader.progress.RunDirectory;
import edu.harvard.hms.dbmi.avillach.uploader.progress.StatusStore;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiConnectionException;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSession;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSettings;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.SampleServiceApi;
import edu.harvard.hms.dbmi.avillach.uploader.upload.failure.FailureReason;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationError;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one upload attempt per directory: mark PARTIAL, parse and validate offline, connect,
 * validate online, upload, mark COMPLETE.
 *
 * Failures caused by the run (bad sheet, missing files, rejected by the service) mark the
 * directory ERROR. Failures of the session (service unreachable, connection dropped) leave it
 * PARTIAL so an operator can retry. Domain errors never escape as exceptions; each attempt ends
 * in an {@link UploadOutcome}.
 */
public class UploadOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

    static final String MDC_RUN_DIRECTORY = "runDirectory";

    private static final String VERSION = Optional.ofNullable(UploadOrchestrator.class.getPackage().getImplementationVersion())
        .orElse("development");

    private final SampleSheetParser parser;
    private final DirectoryScanner scanner;
    private final StatusStore statusStore;
    private final SampleServiceApi api;
    private final ApiSettings apiSettings;
    private final boolean force;

    public UploadOrchestrator(SampleSheetParser parser, DirectoryScanner scanner, StatusStore statusStore,
                              SampleServiceApi api, ApiSettings apiSettings, boolean force) {
        this.parser = parser;
        this.scanner = scanner;
        this.statusStore = statusStore;
        this.api = api;
        this.apiSettings = apiSettings;
        this.force = force;
    }

    /**
     * Uploads the run in {@code directory}.
     */
    public UploadOutcome uploadSingleRun(Path directory) {
        MDC.put(MDC_RUN_DIRECTORY, directory.toString());
        logStartBlock();
        try {
            UploadOutcome outcome = attempt(directory);
            if (outcome.isFailed()) {
                log.info("Samples not uploaded, {}: {}", outcome.failureReason(), outcome.failureReason().getDescription());
            }
            return outcome;
        } finally {
            logEndBlock();
            MDC.remove(MDC_RUN_DIRECTORY);
        }
    }

    /**
     * Uploads the first NEW run under {@code root}, in name order. Finding none is a success.
     *
     * @throws DirectoryException if {@code root} itself cannot be read
     */
    public UploadOutcome uploadFirstNewRun(Path root) throws DirectoryException {
        log.info("Finding first new run in directory: {}", root);
        Optional<RunDirectory> firstRun;
        try {
            firstRun = scanner.findFirstNewRun(root);
        } catch (DirectoryException e) {
            log.error("Could not read directory {} while looking for runs: {}", e.getDirectory(), e.getMessage());
            throw e;
        }
        if (firstRun.isEmpty()) {
            log.info("Could not find any new runs in directory: {}", root);
            return UploadOutcome.skipped(root);
        }
        log.info("New run found. Starting upload on directory: {}", firstRun.get().directory());
        return uploadSingleRun(firstRun.get().directory());
    }

    /**
     * Uploads every NEW run under {@code root}, in name order. A failed run does not stop the
     * ones after it.
     *
     * @throws DirectoryException if {@code root} itself cannot be read
     */
    public List<UploadOutcome> batchUpload(Path root) throws DirectoryException {
        List<RunDirectory> runs = scanner.findRuns(root);
        List<UploadOutcome> outcomes = new ArrayList<>();
        for (RunDirectory run : runs) {
            if (!run.isNew()) {
                log.info("Skipping {}, it is {}", run.directory(), run.status());
                continue;
            }
            outcomes.add(uploadSingleRun(run.directory()));
        }
        long failed = outcomes.stream().filter(UploadOutcome::isFailed).count();
        log.info("Batch upload of {} finished: {} runs attempted, {} failed", root, outcomes.size(), failed);
        return outcomes;
    }

    private UploadOutcome attempt(Path directory) {
        RunDirectory run;
        try {
            run = scanner.findSingleRun(directory);
        } catch (DirectoryException e) {
            log.error("Could not read status of directory {}: {}", e.getDirectory(), e.getMessage());
            return fail(directory, UploadStage.START, FailureReason.STATUS_UNREADABLE, List.of(e.toValidationError()));
        }

        if (run.status() == DirectoryStatus.INVALID) {
            log.error("Directory {} is not a finished run: {}", directory, run.message());
            return fail(directory, UploadStage.START, FailureReason.INVALID_DIRECTORY,
                List.of(new ValidationError(ErrorKind.DIRECTORY, run.message(), directory.toString())));
        }
        if (run.status() == DirectoryStatus.COMPLETE && !force) {
            log.info("Directory {} has already been uploaded, skipping. Set uploader.force=true to upload it again", directory);
            return UploadOutcome.skipped(directory);
        }
        if (run.status() != DirectoryStatus.NEW) {
            log.warn("Directory {} is {}, uploading again", directory, run.status());
        }

        try {
            statusStore.writeStatus(directory, DirectoryStatus.PARTIAL);
        } catch (DirectoryException e) {
            log.error("Could not mark directory {} as PARTIAL: {}", e.getDirectory(), e.getMessage());
            return fail(directory, UploadStage.START, FailureReason.STATUS_WRITE_FAILED, List.of(e.toValidationError()));
        }

        UploadStage stage = UploadStage.STATUS_WRITTEN;
        SequencingRun sequencingRun;
        try {
            Path sampleSheet = parser.getSampleSheet(directory);
            DataDirectoryStruct dataDirectory = parser.getDataDirectoryStruct(sampleSheet);
            stage = UploadStage.PARSED;
            sequencingRun = parser.getSequencingRun(sampleSheet, dataDirectory);
        } catch (DirectoryException e) {
            log.error("Directory {} can not be parsed: {}", e.getDirectory(), e.getMessage());
            return fail(directory, stage, FailureReason.DIRECTORY_ERROR, List.of(e.toValidationError()));
        } catch (ValidationException e) {
            log.error("Offline validation failed: {}", e.getMessage());
            logErrors(e.getResult());
            return fail(directory, stage, FailureReason.OFFLINE_VALIDATION_FAILED, e.getResult().getErrors());
        }
        stage = UploadStage.OFFLINE_VALID;
        log.info("Parsed {} samples in {} projects", sequencingRun.sampleCount(), sequencingRun.projects().size());

        log.info("*** Connecting to the sample service ***");
        ApiSession session;
        try {
            session = api.connect(apiSettings);
        } catch (ApiConnectionException e) {
            log.error("Could not connect to the sample service: {}", e.getMessage());
            return fail(directory, stage, FailureReason.CONNECTION_FAILED, List.of());
        }
        stage = UploadStage.CONNECTED;
        log.info("*** Connected ***");

        log.info("*** Verifying run (online validation) ***");
        ValidationResult onlineResult;
        try {
            onlineResult = session.validateForUpload(sequencingRun);
        } catch (ApiConnectionException e) {
            log.error("Lost connection to the sample service: {}", e.getMessage());
            return fail(directory, stage, FailureReason.CONNECTION_LOST, List.of());
        }
        if (!onlineResult.isValid()) {
            log.error("Sequencing run can not be uploaded. Encountered {} errors", onlineResult.errorCount());
            logErrors(onlineResult);
            return fail(directory, stage, FailureReason.REMOTE_VALIDATION_FAILED, onlineResult.getErrors());
        }
        stage = UploadStage.ONLINE_VALID;
        log.info("*** Run Verified ***");

        log.info("*** Starting Upload ***");
        try {
            session.uploadSequencingRun(sequencingRun);
        } catch (ApiConnectionException e) {
            log.error("Lost connection to the sample service during upload: {}", e.getMessage());
            return fail(directory, stage, FailureReason.UPLOAD_FAILED, List.of());
        }
        log.info("*** Upload Complete ***");

        boolean completeStatusWritten = true;
        try {
            statusStore.writeStatus(directory, DirectoryStatus.COMPLETE);
        } catch (DirectoryException e) {
            completeStatusWritten = false;
            log.error("Could not mark directory {} as COMPLETE: {}", e.getDirectory(), e.getMessage());
            log.error("Samples were uploaded, but the status file still reads PARTIAL");
        }
        log.info("All samples in {} uploaded", directory);
        return UploadOutcome.done(directory, completeStatusWritten);
    }

    private UploadOutcome fail(Path directory, UploadStage stage, FailureReason reason, List<ValidationError> errors) {
        if (reason.marksDirectoryError()) {
            try {
                statusStore.writeStatus(directory, DirectoryStatus.ERROR, reason.getDescription());
            } catch (DirectoryException e) {
                log.error("Could not mark directory {} as ERROR: {}", e.getDirectory(), e.getMessage());
            }
        }
        return UploadOutcome.failed(directory, stage, reason, errors);
    }

    private static void logErrors(ValidationResult result) {
        for (ValidationError error : result.getErrors()) {
            log.error("  {}", error);
        }
    }

    private static void logStartBlock() {
        log.info("==================================================");
        log.info("---------------STARTING UPLOAD RUN----------------");
        log.info("Uploader Version {}", VERSION);
        log.info("==================================================");
    }

    private static void logEndBlock() {
        log.info("==================================================");
        log.info("----------------ENDING UPLOAD RUN-----------------");
        log.info("==================================================");
    }
}
