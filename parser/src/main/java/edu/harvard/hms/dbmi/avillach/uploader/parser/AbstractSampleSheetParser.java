package edu.harvard.hms.dbmi.avillach.uploader.parser;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.Sample;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequenceFile;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SampleSheetException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SequenceFileException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.ValidationException;
import edu.harvard.hms.dbmi.avillach.uploader.parser.sheet.DataTable;
import edu.harvard.hms.dbmi.avillach.uploader.parser.sheet.SampleSheet;
import edu.harvard.hms.dbmi.avillach.uploader.parser.sheet.SampleSheetReader;
import edu.harvard.hms.dbmi.avillach.uploader.parser.sheet.SampleSheetValidator;
import edu.harvard.hms.dbmi.avillach.uploader.parser.sheet.SheetLine;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared handling of Illumina sample sheets. Platforms differ in the files that mark a finished
 * run, the header keys they insist on and where sample files sit in the data directory.
 */
public abstract class AbstractSampleSheetParser implements SampleSheetParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractSampleSheetParser.class);

    public static final String SAMPLE_SHEET_FILE_NAME = "SampleSheet.csv";

    private static final Path DATA_DIRECTORY = Path.of("Data", "Intensities", "BaseCalls");

    private final SampleSheetReader reader;
    private final SampleSheetValidator validator;
    private final RunModelBuilder runModelBuilder;

    protected AbstractSampleSheetParser() {
        this.reader = new SampleSheetReader();
        this.validator = new SampleSheetValidator(reader);
        this.runModelBuilder = new RunModelBuilder();
    }

    /**
     * @return [Header] keys that must be present with a value
     */
    protected abstract List<String> getRequiredMetadataKeys();

    /**
     * Adds the sequence file listing of {@code dataDirectory} to {@code builder}.
     */
    protected abstract void listDataDirectory(Path dataDirectory, DataDirectoryStruct.Builder builder) throws IOException;

    /**
     * Finds the files of one sample in the listing.
     */
    protected abstract List<SequenceFile> resolveSequenceFiles(String sampleName, int sampleNumber, String projectId,
                                                               DataDirectoryStruct dataDirectory) throws SequenceFileException;

    @Override
    public Path getRelativeDataDirectory() {
        return DATA_DIRECTORY;
    }

    @Override
    public Path getSampleSheet(Path directory) throws DirectoryException {
        log.info("Looking for sample sheet in {}", directory);

        // the status file is written next to the sheet, so the directory must be writable as well
        if (!Files.isDirectory(directory) || !Files.isReadable(directory) || !Files.isWritable(directory)) {
            log.error("The directory is not accessible, can not parse samples from this directory {}", directory);
            throw new DirectoryException("The directory is not accessible, can not parse samples from this directory " + directory, directory);
        }

        Path sampleSheet = directory.resolve(SAMPLE_SHEET_FILE_NAME);
        if (!Files.isRegularFile(sampleSheet)) {
            log.error("No sample sheet file in the {} format found", getPlatform());
            throw new DirectoryException("The directory " + directory + " has no sample sheet file in the " + getPlatform()
                + " format with the name " + SAMPLE_SHEET_FILE_NAME, directory);
        }
        log.debug("Sample sheet found");
        return sampleSheet;
    }

    @Override
    public DataDirectoryStruct getDataDirectoryStruct(Path sampleSheet) throws DirectoryException {
        Path dataDirectory = sampleSheet.toAbsolutePath().getParent().resolve(getRelativeDataDirectory());
        if (!Files.isDirectory(dataDirectory)) {
            throw new DirectoryException("Data directory " + dataDirectory + " does not exist", dataDirectory);
        }
        DataDirectoryStruct.Builder builder = DataDirectoryStruct.builder(dataDirectory);
        try {
            listDataDirectory(dataDirectory, builder);
        } catch (IOException e) {
            throw new DirectoryException("Could not list data directory " + dataDirectory + ": " + e.getMessage(), dataDirectory, e);
        }
        return builder.build();
    }

    @Override
    public SampleSheetMetadata parseMetadata(Path sampleSheet) throws SampleSheetException {
        SampleSheet sheet = readSheet(sampleSheet);

        Map<String, String> values = new LinkedHashMap<>();
        for (SheetLine line : sheet.getSection(SampleSheet.HEADER).orElse(List.of())) {
            String key = line.cell(0);
            if (key.isEmpty() || line.size() > 2) {
                throw new SampleSheetException("Header rows must be a key and a single value", sampleSheet, line.lineNumber(), line.raw());
            }
            values.put(key, line.cell(1));
        }
        for (String requiredKey : getRequiredMetadataKeys()) {
            if (values.getOrDefault(requiredKey, "").isEmpty()) {
                throw new SampleSheetException("The [Header] section has no value for " + requiredKey, sampleSheet);
            }
        }

        List<Integer> readLengths = new ArrayList<>();
        for (SheetLine line : sheet.getSection(SampleSheet.READS).orElse(List.of())) {
            try {
                readLengths.add(Integer.parseInt(line.cell(0)));
            } catch (NumberFormatException e) {
                throw new SampleSheetException("Read length is not a number", sampleSheet, line.lineNumber(), line.raw());
            }
        }
        if (readLengths.isEmpty()) {
            throw new SampleSheetException("The [Reads] section lists no read lengths", sampleSheet);
        }

        log.debug("Parsed metadata {} with read lengths {} from {}", values.keySet(), readLengths, sampleSheet);
        return new SampleSheetMetadata(values, readLengths);
    }

    @Override
    public SampleParseResult parseSamples(Path sampleSheet, DataDirectoryStruct dataDirectory) {
        ValidationResult result = new ValidationResult();
        SampleSheet sheet;
        try {
            sheet = reader.read(sampleSheet);
        } catch (IOException e) {
            result.addError(ErrorKind.SAMPLE_SHEET, "Sample sheet could not be read: " + e.getMessage(), sampleSheet.toString());
            return new SampleParseResult(List.of(), result);
        }

        Optional<DataTable> table = DataTable.from(sheet);
        if (table.isEmpty()) {
            result.addError(ErrorKind.SAMPLE_SHEET, "Sample sheet has no [Data] section", sampleSheet.toString());
            return new SampleParseResult(List.of(), result);
        }

        DataTable data = table.get();
        List<Sample> samples = new ArrayList<>();
        int sampleNumber = 0;
        for (SheetLine row : data.getRows()) {
            sampleNumber++;
            String sampleName = data.sampleIdentifier(row);
            String projectId = data.get(row, DataTable.SAMPLE_PROJECT);
            if (sampleName.isEmpty() || projectId.isEmpty()) {
                log.debug("Skipping line {}, it has no sample identifier or project", row.lineNumber());
                continue;
            }
            try {
                List<SequenceFile> files = resolveSequenceFiles(sampleName, sampleNumber, projectId, dataDirectory);
                samples.add(new Sample(sampleName, data.get(row, DataTable.SAMPLE_ID), projectId, sampleNumber,
                    data.get(row, DataTable.DESCRIPTION), files));
            } catch (SequenceFileException e) {
                log.error("Could not resolve files for sample {}: {}", sampleName, e.getMessage());
                result.addError(e.toValidationError());
            }
        }

        log.info("Parsed {} samples from {} with {} file errors", samples.size(), sampleSheet, result.errorCount());
        return new SampleParseResult(samples, result);
    }

    @Override
    public SequencingRun getSequencingRun(Path sampleSheet) throws ValidationException {
        DataDirectoryStruct dataDirectory;
        try {
            dataDirectory = getDataDirectoryStruct(sampleSheet);
        } catch (DirectoryException e) {
            log.error("Errors occurred while listing sequence files");
            throw new ValidationException("Errors occurred while listing sequence files", ValidationResult.of(e.toValidationError()));
        }
        return getSequencingRun(sampleSheet, dataDirectory);
    }

    @Override
    public SequencingRun getSequencingRun(Path sampleSheet, DataDirectoryStruct dataDirectory) throws ValidationException {
        ValidationResult sheetResult = validator.validateSampleSheet(sampleSheet);
        if (!sheetResult.isValid()) {
            log.error("Errors occurred while validating sample sheet");
            throw new ValidationException("Errors occurred while validating sample sheet", sheetResult);
        }

        SampleSheetMetadata metadata;
        try {
            metadata = parseMetadata(sampleSheet);
        } catch (SampleSheetException e) {
            log.error("Errors occurred while parsing metadata");
            throw new ValidationException("Errors occurred while parsing metadata", ValidationResult.of(e.toValidationError()));
        }

        SampleParseResult samples = parseSamples(sampleSheet, dataDirectory);
        if (!samples.isValid()) {
            log.error("Errors occurred while resolving sequence files");
            throw new ValidationException("Errors occurred while resolving sequence files", samples.validationResult());
        }

        try {
            return runModelBuilder.build(samples.samples(), metadata, getPlatform());
        } catch (SequenceFileException e) {
            log.error("Errors occurred while building sequence run from sample sheet");
            throw new ValidationException("Errors occurred while building sequence run from sample sheet",
                ValidationResult.of(e.toValidationError()));
        }
    }

    /**
     * @return names of the regular files directly inside {@code directory}, sorted
     */
    protected static List<String> listFileNames(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private SampleSheet readSheet(Path sampleSheet) throws SampleSheetException {
        try {
            return reader.read(sampleSheet);
        } catch (IOException e) {
            throw new SampleSheetException("Sample sheet could not be read: " + e.getMessage(), sampleSheet);
        }
    }
}
