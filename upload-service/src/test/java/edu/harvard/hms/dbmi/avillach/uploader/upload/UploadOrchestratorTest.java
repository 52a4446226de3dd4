package edu.harvard.hms.dbmi.avillach.uploader.upload;

import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.DirectoryScanner;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SampleSheetParser;
import edu.harvard.hms.dbmi.avillach.uploader.parser.nextseq.NextSeqParser;
import edu.harvard.hms.dbmi.avillach.uploader.progress.DirectoryStatus;
import edu.harvard.hms.dbmi.avillach.uploader.progress.StatusStore;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiConnectionException;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSession;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSettings;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.SampleServiceApi;
import edu.harvard.hms.dbmi.avillach.uploader.upload.failure.FailureReason;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadOrchestratorTest {

    private static final ApiSettings SETTINGS = new ApiSettings("http://localhost:8080", "uploader", null, "user", "pw", Duration.ofSeconds(5));

    private final SampleServiceApi api;
    private final ApiSession session;

    private final SampleSheetParser parser = new NextSeqParser();
    private final StatusStore statusStore = new StatusStore();

    @TempDir
    Path root;

    UploadOrchestratorTest(@Mock SampleServiceApi api, @Mock ApiSession session) {
        this.api = api;
        this.session = session;
    }

    private UploadOrchestrator orchestrator(StatusStore store, boolean force) {
        return new UploadOrchestrator(parser, new DirectoryScanner(parser, store), store, api, SETTINGS, force);
    }

    private UploadOrchestrator orchestrator() {
        return orchestrator(statusStore, false);
    }

    @Test
    void shouldMarkCompleteAfterSuccessfulUpload() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(0, outcome.exitCode());
        assertEquals(UploadStage.DONE, outcome.stage());
        assertTrue(outcome.completeStatusWritten());
        assertEquals(DirectoryStatus.COMPLETE, statusStore.readStatus(run));

        ArgumentCaptor<SequencingRun> uploaded = ArgumentCaptor.forClass(SequencingRun.class);
        verify(session).uploadSequencingRun(uploaded.capture());
        assertEquals(2, uploaded.getValue().sampleCount());
        assertEquals("run-1", uploaded.getValue().metadata().runId().orElseThrow());
    }

    @Test
    void shouldExitWithoutMarkerForInvalidDirectory() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        Files.delete(run.resolve("RTAComplete.txt"));

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.INVALID_DIRECTORY, outcome.failureReason());
        assertFalse(Files.exists(run.resolve(StatusStore.STATUS_FILE_NAME)));
        verifyNoInteractions(api);
    }

    @Test
    void shouldSkipCompleteDirectory() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        statusStore.writeStatus(run, DirectoryStatus.COMPLETE);

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.skipped());
        assertEquals(DirectoryStatus.COMPLETE, statusStore.readStatus(run));
        verifyNoInteractions(api);
    }

    @Test
    void shouldUploadCompleteDirectoryAgainWhenForced() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        statusStore.writeStatus(run, DirectoryStatus.COMPLETE);
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());

        UploadOutcome outcome = orchestrator(statusStore, true).uploadSingleRun(run);

        assertEquals(UploadStage.DONE, outcome.stage());
        verify(session).uploadSequencingRun(any());
    }

    @Test
    void shouldMarkErrorWhenOfflineValidationFails() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        Files.writeString(run.resolve("SampleSheet.csv"), UploadFixtures.SHEET + "S3,alpha,p1\n");

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.OFFLINE_VALIDATION_FAILED, outcome.failureReason());
        assertEquals(UploadStage.PARSED, outcome.stage());
        assertEquals(ErrorKind.DUPLICATE_SAMPLE, outcome.errors().get(0).kind());
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(run));
        verifyNoInteractions(api);
    }

    @Test
    void shouldMarkErrorForMissingSequenceFile() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        Files.delete(run.resolve("Data/Intensities/BaseCalls/p1/beta_S2_L001_R1_001.fastq.gz"));

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(FailureReason.OFFLINE_VALIDATION_FAILED, outcome.failureReason());
        assertEquals(ErrorKind.SEQUENCE_FILE, outcome.errors().get(0).kind());
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(run));
    }

    @Test
    void shouldMarkErrorForMissingDataDirectory() throws Exception {
        Path run = Files.createDirectories(root.resolve("run"));
        Files.writeString(run.resolve("SampleSheet.csv"), UploadFixtures.SHEET);
        Files.writeString(run.resolve("RTAComplete.txt"), "");

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(FailureReason.DIRECTORY_ERROR, outcome.failureReason());
        assertEquals(UploadStage.STATUS_WRITTEN, outcome.stage());
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(run));
    }

    @Test
    void shouldLeavePartialWhenConnectionFails() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        when(api.connect(SETTINGS)).thenThrow(new ApiConnectionException("connection refused"));

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.CONNECTION_FAILED, outcome.failureReason());
        assertEquals(UploadStage.OFFLINE_VALID, outcome.stage());
        assertEquals(DirectoryStatus.PARTIAL, statusStore.readStatus(run));
    }

    @Test
    void shouldLeavePartialWhenConnectionIsLostDuringValidation() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenThrow(new ApiConnectionException("timeout"));

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(FailureReason.CONNECTION_LOST, outcome.failureReason());
        assertEquals(DirectoryStatus.PARTIAL, statusStore.readStatus(run));
        verify(session, never()).uploadSequencingRun(any());
    }

    @Test
    void shouldMarkErrorWhenServiceRejectsRun() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(
            new ValidationResult().addError(ErrorKind.REMOTE_REJECTED, "Project p1 does not exist", "p1"));

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.REMOTE_VALIDATION_FAILED, outcome.failureReason());
        assertEquals(UploadStage.CONNECTED, outcome.stage());
        assertEquals(1, outcome.errors().size());
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(run));
        verify(session, never()).uploadSequencingRun(any());
    }

    @Test
    void shouldLeavePartialWhenUploadFails() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());
        doThrow(new ApiConnectionException("connection reset")).when(session).uploadSequencingRun(any());

        UploadOutcome outcome = orchestrator().uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.UPLOAD_FAILED, outcome.failureReason());
        assertEquals(UploadStage.ONLINE_VALID, outcome.stage());
        assertEquals(DirectoryStatus.PARTIAL, statusStore.readStatus(run));
    }

    @Test
    void shouldSucceedWhenCompleteMarkerCannotBeWritten() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        StatusStore store = spy(new StatusStore());
        lenient().doThrow(new DirectoryException("disk full", run)).when(store).writeStatus(run, DirectoryStatus.COMPLETE);
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());

        UploadOutcome outcome = orchestrator(store, false).uploadSingleRun(run);

        assertEquals(0, outcome.exitCode());
        assertEquals(UploadStage.DONE, outcome.stage());
        assertFalse(outcome.completeStatusWritten());
        assertEquals(DirectoryStatus.PARTIAL, statusStore.readStatus(run));
    }

    @Test
    void shouldStopBeforeParsingWhenPartialMarkerCannotBeWritten() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        statusStore.writeStatus(run, DirectoryStatus.ERROR, "previous attempt");
        StatusStore store = spy(new StatusStore());
        doThrow(new DirectoryException("read-only file system", run)).when(store).writeStatus(run, DirectoryStatus.PARTIAL);

        UploadOutcome outcome = orchestrator(store, false).uploadSingleRun(run);

        assertEquals(1, outcome.exitCode());
        assertEquals(FailureReason.STATUS_WRITE_FAILED, outcome.failureReason());
        assertEquals(UploadStage.START, outcome.stage());
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(run));
        assertEquals("previous attempt", statusStore.readMarker(run).orElseThrow().message());
        verify(store, never()).writeStatus(eq(run), eq(DirectoryStatus.ERROR), any());
        verifyNoInteractions(api);
    }

    @Test
    void shouldUploadFirstNewRunAndSkipFinishedRuns() throws Exception {
        statusStore.writeStatus(UploadFixtures.createRun(root, "a"), DirectoryStatus.COMPLETE);
        statusStore.writeStatus(UploadFixtures.createRun(root, "b"), DirectoryStatus.ERROR);
        Path fresh = UploadFixtures.createRun(root, "c");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());

        UploadOutcome outcome = orchestrator().uploadFirstNewRun(root);

        assertEquals(fresh, outcome.directory());
        assertEquals(DirectoryStatus.COMPLETE, statusStore.readStatus(fresh));
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(root.resolve("b")));
    }

    @Test
    void shouldSucceedWhenNoNewRunExists() throws Exception {
        statusStore.writeStatus(UploadFixtures.createRun(root, "a"), DirectoryStatus.COMPLETE);

        UploadOutcome outcome = orchestrator().uploadFirstNewRun(root);

        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.skipped());
        verifyNoInteractions(api);
    }

    @Test
    void shouldPropagateUnreadableRootWhenLookingForFirstNewRun() {
        assertThrows(DirectoryException.class, () -> orchestrator().uploadFirstNewRun(root.resolve("absent")));
    }

    @Test
    void shouldContinueBatchUploadAfterFailure() throws Exception {
        Path broken = UploadFixtures.createRun(root, "a");
        Files.writeString(broken.resolve("SampleSheet.csv"), "[Data]\nSample_ID\n");
        Path good = UploadFixtures.createRun(root, "b");
        when(api.connect(SETTINGS)).thenReturn(session);
        when(session.validateForUpload(any())).thenReturn(new ValidationResult());

        List<UploadOutcome> outcomes = orchestrator().batchUpload(root);

        assertEquals(2, outcomes.size());
        assertEquals(1, UploadOutcome.exitCode(outcomes));
        assertEquals(DirectoryStatus.ERROR, statusStore.readStatus(broken));
        assertEquals(DirectoryStatus.COMPLETE, statusStore.readStatus(good));
    }

    @Test
    void shouldRemoveRunDirectoryFromMdcAfterAttempt() throws Exception {
        Path run = UploadFixtures.createRun(root, "run");
        Files.delete(run.resolve("RTAComplete.txt"));

        orchestrator().uploadSingleRun(run);

        assertNull(MDC.get(UploadOrchestrator.MDC_RUN_DIRECTORY));
    }
}
