package edu.harvard.hms.dbmi.avillach.uploader.upload;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.uploader.upload.failure.FailureReason;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationError;

import java.nio.file.Path;
import java.util.List;

/**
 * What one upload attempt did.
 *
 * @param directory             the run directory, or the scanned root when no run was picked
 * @param stage                 last stage reached
 * @param failureReason         null unless the attempt failed
 * @param errors                validation errors behind the failure, if any
 * @param skipped               true when nothing was attempted (already complete, nothing new)
 * @param completeStatusWritten false when the upload went through but the COMPLETE marker could not be written
 */
public record UploadOutcome(
    Path directory,
    UploadStage stage,
    FailureReason failureReason,
    List<ValidationError> errors,
    boolean skipped,
    boolean completeStatusWritten
) {
    public UploadOutcome {
        errors = ImmutableList.copyOf(errors);
    }

    public static UploadOutcome done(Path directory, boolean completeStatusWritten) {
        return new UploadOutcome(directory, UploadStage.DONE, null, List.of(), false, completeStatusWritten);
    }

    public static UploadOutcome skipped(Path directory) {
        return new UploadOutcome(directory, UploadStage.START, null, List.of(), true, false);
    }

    public static UploadOutcome failed(Path directory, UploadStage stage, FailureReason reason, List<ValidationError> errors) {
        return new UploadOutcome(directory, stage, reason, errors, false, false);
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public int exitCode() {
        return isFailed() ? 1 : 0;
    }

    /**
     * @return 1 if any attempt failed, otherwise 0
     */
    public static int exitCode(List<UploadOutcome> outcomes) {
        return outcomes.stream().anyMatch(UploadOutcome::isFailed) ? 1 : 0;
    }
}
