package edu.harvard.hms.dbmi.avillach.uploader.parser;

import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SampleSheetException;
import edu.harvard.hms.dbmi.avillach.uploader.exception.ValidationException;

import java.nio.file.Path;
import java.util.List;

/**
 * Platform specific knowledge of a run directory: where the sheet is, which files mark a
 * finished run, how the sheet reads and how sample files are named.
 */
public interface SampleSheetParser {

    /**
     * @return platform name reported with uploaded runs
     */
    String getPlatform();

    /**
     * @return file names that must all exist before a run directory may be uploaded
     */
    List<String> getRequiredFileList();

    /**
     * @return the sequence file directory, relative to the directory holding the sample sheet
     */
    Path getRelativeDataDirectory();

    /**
     * @throws DirectoryException if the directory is not accessible or has no sample sheet
     */
    Path getSampleSheet(Path directory) throws DirectoryException;

    /**
     * Lists the data directory next to the sample sheet. This reads the filesystem; cloud
     * callers build a {@link DataDirectoryStruct} themselves instead.
     */
    DataDirectoryStruct getDataDirectoryStruct(Path sampleSheet) throws DirectoryException;

    SampleSheetMetadata parseMetadata(Path sampleSheet) throws SampleSheetException;

    /**
     * Parses the sample rows and resolves each sample's files from {@code dataDirectory}. A
     * sample whose files cannot be resolved is left out and reported in the result; the others
     * are still returned.
     */
    SampleParseResult parseSamples(Path sampleSheet, DataDirectoryStruct dataDirectory);

    /**
     * Validates the sheet and builds the run, listing the data directory from the filesystem.
     *
     * @throws ValidationException carrying every problem found
     */
    SequencingRun getSequencingRun(Path sampleSheet) throws ValidationException;

    /**
     * Validates the sheet and builds the run against a supplied data directory listing.
     *
     * @throws ValidationException carrying every problem found
     */
    SequencingRun getSequencingRun(Path sampleSheet, DataDirectoryStruct dataDirectory) throws ValidationException;
}
