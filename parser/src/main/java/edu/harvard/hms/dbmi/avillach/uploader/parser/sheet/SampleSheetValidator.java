package edu.harvard.hms.dbmi.avillach.uploader.parser.sheet;

import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks of a sample sheet.
 *
 * Every line is checked and every problem recorded; nothing here stops at the first error.
 */
public class SampleSheetValidator {
    private static final Logger log = LoggerFactory.getLogger(SampleSheetValidator.class);

    private static final List<String> REQUIRED_SECTIONS = List.of(SampleSheet.HEADER, SampleSheet.READS, SampleSheet.DATA);
    private static final List<String> REQUIRED_COLUMNS = List.of(DataTable.SAMPLE_ID, DataTable.SAMPLE_PROJECT);

    private final SampleSheetReader reader;

    public SampleSheetValidator() {
        this(new SampleSheetReader());
    }

    public SampleSheetValidator(SampleSheetReader reader) {
        this.reader = reader;
    }

    public ValidationResult validateSampleSheet(Path sampleSheet) {
        try {
            return validateSampleSheet(reader.read(sampleSheet));
        } catch (IOException e) {
            log.error("Could not read sample sheet {}: {}", sampleSheet, e.getMessage());
            return new ValidationResult().addError(ErrorKind.SAMPLE_SHEET,
                "Sample sheet could not be read: " + e.getMessage(), sampleSheet.toString());
        }
    }

    public ValidationResult validateSampleSheet(SampleSheet sheet) {
        ValidationResult result = new ValidationResult();
        String sheetName = String.valueOf(sheet.getPath());

        for (String section : REQUIRED_SECTIONS) {
            if (!sheet.hasSection(section)) {
                result.addError(ErrorKind.SAMPLE_SHEET, "Sample sheet is missing the [" + section + "] section", sheetName);
            }
        }

        Optional<DataTable> table = DataTable.from(sheet);
        if (table.isEmpty()) {
            if (sheet.hasSection(SampleSheet.DATA)) {
                result.addError(ErrorKind.SAMPLE_SHEET, "The [Data] section has no column header line", sheetName);
            }
            logResult(sheet, result);
            return result;
        }

        DataTable data = table.get();
        boolean columnsPresent = true;
        for (String column : REQUIRED_COLUMNS) {
            if (!data.hasColumn(column)) {
                columnsPresent = false;
                result.addError(ErrorKind.SAMPLE_SHEET, "The [Data] section has no " + column + " column",
                    lineEntity(sheet, data.getHeaderLine()));
            }
        }
        if (data.getRows().isEmpty()) {
            result.addError(ErrorKind.SAMPLE_SHEET, "The [Data] section lists no samples", sheetName);
        }
        if (columnsPresent) {
            validateRows(sheet, data, result);
        }

        logResult(sheet, result);
        return result;
    }

    /**
     * Each row needs an id and a project, and sample identifiers must be unique within a project.
     * Later occurrences of a repeated identifier are the ones reported.
     */
    private void validateRows(SampleSheet sheet, DataTable data, ValidationResult result) {
        Map<String, Set<String>> seenByProject = new HashMap<>();
        for (SheetLine row : data.getRows()) {
            String sampleId = data.get(row, DataTable.SAMPLE_ID);
            String project = data.get(row, DataTable.SAMPLE_PROJECT);
            if (sampleId.isEmpty()) {
                result.addError(ErrorKind.SAMPLE_SHEET, "Sample has no " + DataTable.SAMPLE_ID, lineEntity(sheet, row));
            }
            if (project.isEmpty()) {
                result.addError(ErrorKind.SAMPLE_SHEET, "Sample has no " + DataTable.SAMPLE_PROJECT, lineEntity(sheet, row));
            }
            if (sampleId.isEmpty() || project.isEmpty()) {
                continue;
            }

            String identifier = data.sampleIdentifier(row);
            if (!seenByProject.computeIfAbsent(project, k -> new HashSet<>()).add(identifier)) {
                result.addError(ErrorKind.DUPLICATE_SAMPLE,
                    "Sample " + identifier + " appears more than once in project " + project, lineEntity(sheet, row));
            }
        }
    }

    private static String lineEntity(SampleSheet sheet, SheetLine line) {
        return sheet.getPath() + ":" + line.lineNumber();
    }

    private static void logResult(SampleSheet sheet, ValidationResult result) {
        if (result.isValid()) {
            log.debug("Sample sheet {} is valid", sheet.getPath());
        } else {
            log.warn("Sample sheet {} has {} errors", sheet.getPath(), result.errorCount());
        }
    }
}
