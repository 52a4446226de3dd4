package edu.harvard.hms.dbmi.avillach.uploader.parser.sheet;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Column access for the [Data] section of a sample sheet. The first line of the section names
 * the columns (case-insensitive); every later line is one sample.
 */
public class DataTable {

    public static final String SAMPLE_ID = "Sample_ID";
    public static final String SAMPLE_NAME = "Sample_Name";
    public static final String SAMPLE_PROJECT = "Sample_Project";
    public static final String DESCRIPTION = "Description";

    private final SheetLine headerLine;
    private final Map<String, Integer> columns = new HashMap<>();
    private final List<SheetLine> rows;

    private DataTable(SheetLine headerLine, List<SheetLine> rows) {
        this.headerLine = headerLine;
        this.rows = rows;
        for (int i = 0; i < headerLine.size(); i++) {
            columns.putIfAbsent(headerLine.cell(i).toLowerCase(Locale.ROOT), i);
        }
    }

    /**
     * @return empty when the sheet has no [Data] section or the section has no column header line
     */
    public static Optional<DataTable> from(SampleSheet sheet) {
        return sheet.getSection(SampleSheet.DATA)
            .filter(lines -> !lines.isEmpty())
            .map(lines -> new DataTable(lines.get(0), lines.subList(1, lines.size())));
    }

    public SheetLine getHeaderLine() {
        return headerLine;
    }

    public List<SheetLine> getRows() {
        return rows;
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the trimmed cell value, or an empty string when the column or cell is absent
     */
    public String get(SheetLine row, String column) {
        Integer index = columns.get(column.toLowerCase(Locale.ROOT));
        return index == null ? "" : row.cell(index);
    }

    /**
     * The identifier a sample is uploaded under: its name, or its id when the name is blank.
     */
    public String sampleIdentifier(SheetLine row) {
        String name = get(row, SAMPLE_NAME);
        return name.isEmpty() ? get(row, SAMPLE_ID) : name;
    }
}
