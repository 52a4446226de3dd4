package edu.harvard.hms.dbmi.avillach.uploader.parser.nextseq;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequenceFile;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SequenceFileException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.AbstractSampleSheetParser;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SequenceFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * NextSeq runs. BCL conversion writes each project's FASTQ files into its own folder under
 * {@code Data/Intensities/BaseCalls}, and {@code RTAComplete.txt} appears once the instrument
 * is done.
 */
public class NextSeqParser extends AbstractSampleSheetParser {
    private static final Logger log = LoggerFactory.getLogger(NextSeqParser.class);

    public static final String PLATFORM = "NextSeq";

    private static final List<String> REQUIRED_FILES = List.of(SAMPLE_SHEET_FILE_NAME, "RTAComplete.txt");

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
        List<Path> projectDirectories;
        try (Stream<Path> children = Files.list(dataDirectory)) {
            projectDirectories = children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        }
        for (Path projectDirectory : projectDirectories) {
            List<String> files = listFileNames(projectDirectory);
            log.debug("Project directory {} holds {} files", projectDirectory.getFileName(), files.size());
            builder.add(projectDirectory.getFileName().toString(), files);
        }
    }

    @Override
    protected List<SequenceFile> resolveSequenceFiles(String sampleName, int sampleNumber, String projectId,
                                                      DataDirectoryStruct dataDirectory) throws SequenceFileException {
        List<String> files = dataDirectory.getFiles(projectId)
            .orElseThrow(() -> new SequenceFileException("No project folder " + projectId + " in "
                + dataDirectory.getDataDirectory() + " for sample " + sampleName, sampleName));
        return SequenceFileNames.resolve(sampleName, sampleNumber, projectId, files, dataDirectory);
    }
}
