package edu.harvard.hms.dbmi.avillach.uploader.parser.miseq;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequenceFile;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SequenceFileException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.AbstractSampleSheetParser;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SequenceFileNames;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * MiSeq runs: every FASTQ file of the run sits directly in {@code Data/Intensities/BaseCalls}.
 */
public class MiSeqParser extends AbstractSampleSheetParser {

    public static final String PLATFORM = "MiSeq";

    private static final List<String> REQUIRED_FILES = List.of(SAMPLE_SHEET_FILE_NAME, "CompletedJobInfo.xml");

    @Override
    public String getPlatform() {
        return PLATFORM;
    }

    @Override
    public List<String> getRequiredFileList() {
        return REQUIRED_FILES;
    }

    @Override
    protected List<String> getRequiredMetadataKeys() {
        return List.of(SampleSheetMetadata.WORKFLOW);
    }

    @Override
    protected void listDataDirectory(Path dataDirectory, DataDirectoryStruct.Builder builder) throws IOException {
        builder.add(DataDirectoryStruct.ROOT, listFileNames(dataDirectory));
    }

    @Override
    protected List<SequenceFile> resolveSequenceFiles(String sampleName, int sampleNumber, String projectId,
                                                      DataDirectoryStruct dataDirectory) throws SequenceFileException {
        List<String> files = dataDirectory.getFiles(DataDirectoryStruct.ROOT).orElse(List.of());
        return SequenceFileNames.resolve(sampleName, sampleNumber, DataDirectoryStruct.ROOT, files, dataDirectory);
    }
}
