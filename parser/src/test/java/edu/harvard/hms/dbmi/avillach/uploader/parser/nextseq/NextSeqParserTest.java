package edu.harvard.hms.dbmi.avillach.uploader.parser.nextseq;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.LayoutType;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.ReadDirection;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.Sample;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SampleSheetException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.ValidationException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.RunFixtures;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SampleParseResult;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NextSeqParserTest {

    private final NextSeqParser parser = new NextSeqParser();

    @Test
    void shouldBuildRunGroupedByProject(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "240301_NB501");

        SequencingRun sequencingRun = parser.getSequencingRun(parser.getSampleSheet(run));

        assertEquals(NextSeqParser.PLATFORM, sequencingRun.platform());
        assertEquals(3, sequencingRun.sampleCount());
        assertEquals(List.of("proj1", "proj2"), sequencingRun.projects().stream().map(p -> p.projectId()).toList());
        Sample alpha = sequencingRun.project("proj1").orElseThrow().samples().get(0);
        assertEquals("alpha", alpha.sampleName());
        assertEquals("S-01", alpha.sampleId());
        assertEquals("first sample", alpha.description());
        assertTrue(alpha.isPairedEnd());
        assertEquals(run.resolve("Data/Intensities/BaseCalls/proj1/alpha_S1_L001_R1_001.fastq.gz").toAbsolutePath(),
            alpha.filesFor(ReadDirection.FORWARD).get(0).path());
        assertEquals(LayoutType.PAIRED_END, sequencingRun.metadata().layoutType());
    }

    @Test
    void shouldParseHeaderAndReads(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");

        SampleSheetMetadata metadata = parser.parseMetadata(run.resolve("SampleSheet.csv"));

        assertEquals("run-240301", metadata.runId().orElseThrow());
        assertEquals("GenerateFastQWorkflow", metadata.get(SampleSheetMetadata.WORKFLOW).orElseThrow());
        assertEquals(List.of(151, 151), metadata.readLengths());
    }

    @Test
    void shouldRejectNonNumericReadLength(@TempDir Path dir) throws IOException {
        Path sheet = dir.resolve("SampleSheet.csv");
        Files.writeString(sheet, """
            [Header]
            Workflow,GenerateFASTQ
            [Reads]
            151
            long
            """);

        SampleSheetException e = assertThrows(SampleSheetException.class, () -> parser.parseMetadata(sheet));
        assertEquals(5, e.getLineNumber());
        assertEquals("long", e.getLine());
    }

    @Test
    void shouldRejectHeaderRowWithoutKeyValuePair(@TempDir Path dir) throws IOException {
        Path sheet = dir.resolve("SampleSheet.csv");
        Files.writeString(sheet, """
            [Header]
            Workflow,GenerateFASTQ,extra
            [Reads]
            151
            """);

        SampleSheetException e = assertThrows(SampleSheetException.class, () -> parser.parseMetadata(sheet));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void shouldRequireWorkflowAndReadLengths(@TempDir Path dir) throws IOException {
        Path sheet = dir.resolve("SampleSheet.csv");
        Files.writeString(sheet, "[Header]\nExperiment Name,x\n[Reads]\n151\n");
        assertThrows(SampleSheetException.class, () -> parser.parseMetadata(sheet));

        Files.writeString(sheet, "[Header]\nWorkflow,GenerateFASTQ\n[Reads]\n");
        assertThrows(SampleSheetException.class, () -> parser.parseMetadata(sheet));
    }

    @Test
    void shouldUseSuppliedListingWithoutTouchingTheFilesystem(@TempDir Path dir) throws Exception {
        Path sheet = dir.resolve("SampleSheet.csv");
        Files.writeString(sheet, RunFixtures.NEXTSEQ_SHEET);
        Path remote = Path.of("/bucket/run/Data/Intensities/BaseCalls");
        DataDirectoryStruct listing = DataDirectoryStruct.builder(remote)
            .add("proj1", List.of("alpha_S1_L001_R1_001.fastq.gz", "alpha_S1_L001_R2_001.fastq.gz",
                "beta_S2_L001_R1_001.fastq.gz", "beta_S2_L001_R2_001.fastq.gz"))
            .add("proj2", List.of("gamma_S3_L001_R1_001.fastq.gz", "gamma_S3_L001_R2_001.fastq.gz"))
            .build();

        SequencingRun run = parser.getSequencingRun(sheet, listing);

        assertEquals(3, run.sampleCount());
        assertEquals(remote.resolve("proj2").resolve("gamma_S3_L001_R2_001.fastq.gz"),
            run.project("proj2").orElseThrow().samples().get(0).filesFor(ReadDirection.REVERSE).get(0).path());
    }

    @Test
    void shouldKeepResolvableSamplesWhenOneFails(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");
        Files.delete(run.resolve("Data/Intensities/BaseCalls/proj1/beta_S2_L001_R1_001.fastq.gz"));
        Path sheet = parser.getSampleSheet(run);

        SampleParseResult result = parser.parseSamples(sheet, parser.getDataDirectoryStruct(sheet));

        assertEquals(List.of("alpha", "gamma"), result.samples().stream().map(Sample::sampleName).toList());
        assertEquals(1, result.validationResult().count(ErrorKind.SEQUENCE_FILE));
        assertEquals("beta", result.validationResult().getErrors().get(0).entity());
    }

    @Test
    void shouldFailRunWhenSampleHasNoFiles(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");
        Files.delete(run.resolve("Data/Intensities/BaseCalls/proj2/gamma_S3_L001_R1_001.fastq.gz"));
        Files.delete(run.resolve("Data/Intensities/BaseCalls/proj2/gamma_S3_L001_R2_001.fastq.gz"));
        Path sheet = parser.getSampleSheet(run);

        ValidationException e = assertThrows(ValidationException.class, () -> parser.getSequencingRun(sheet));
        assertEquals(1, e.getResult().count(ErrorKind.SEQUENCE_FILE));
        assertTrue(e.getResult().getErrors().get(0).message().contains("gamma"));
    }

    @Test
    void shouldReportMissingProjectFolder(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");
        Path proj2 = run.resolve("Data/Intensities/BaseCalls/proj2");
        Files.delete(proj2.resolve("gamma_S3_L001_R1_001.fastq.gz"));
        Files.delete(proj2.resolve("gamma_S3_L001_R2_001.fastq.gz"));
        Files.delete(proj2);
        Path sheet = parser.getSampleSheet(run);

        SampleParseResult result = parser.parseSamples(sheet, parser.getDataDirectoryStruct(sheet));

        assertFalse(result.isValid());
        assertTrue(result.validationResult().getErrors().get(0).message().contains("proj2"));
    }

    @Test
    void shouldAcceptSingleEndFiles(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");
        Path proj2 = run.resolve("Data/Intensities/BaseCalls/proj2");
        Files.delete(proj2.resolve("gamma_S3_L001_R2_001.fastq.gz"));

        SequencingRun sequencingRun = parser.getSequencingRun(parser.getSampleSheet(run));

        Sample gamma = sequencingRun.project("proj2").orElseThrow().samples().get(0);
        assertFalse(gamma.isPairedEnd());
        assertEquals(ReadDirection.SINGLE, gamma.sequenceFiles().get(0).direction());
    }

    @Test
    void shouldReportSheetErrorsBeforeLookingAtFiles(@TempDir Path root) throws Exception {
        Path run = RunFixtures.createNextSeqRun(root, "run");
        Files.writeString(run.resolve("SampleSheet.csv"), RunFixtures.NEXTSEQ_SHEET + "S-04,alpha,,N704,TCCTGAGC,proj1\n");

        ValidationException e = assertThrows(ValidationException.class, () -> parser.getSequencingRun(run.resolve("SampleSheet.csv")));
        assertEquals(1, e.getResult().count(ErrorKind.DUPLICATE_SAMPLE));
        assertEquals(0, e.getResult().count(ErrorKind.SEQUENCE_FILE));
    }

    @Test
    void shouldRejectDirectoryWithoutSampleSheet(@TempDir Path dir) {
        DirectoryException e = assertThrows(DirectoryException.class, () -> parser.getSampleSheet(dir));
        assertEquals(dir, e.getDirectory());
    }

    @Test
    void shouldWrapMissingDataDirectory(@TempDir Path dir) throws IOException {
        Path sheet = dir.resolve("SampleSheet.csv");
        Files.writeString(sheet, RunFixtures.NEXTSEQ_SHEET);

        ValidationException e = assertThrows(ValidationException.class, () -> parser.getSequencingRun(sheet));
        assertEquals(1, e.getResult().count(ErrorKind.DIRECTORY));
    }
}
