package edu.harvard.hms.dbmi.avillach.uploader.parser.sheet;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One non-blank line of a sample sheet, with trailing empty cells removed.
 *
 * @param lineNumber 1-based line number in the file
 * @param cells      trimmed cell values
 * @param raw        the line as written, for error messages
 */
public record SheetLine(long lineNumber, List<String> cells, String raw) {

    public SheetLine {
        cells = ImmutableList.copyOf(cells);
    }

    public String cell(int index) {
        return index < cells.size() ? cells.get(index) : "";
    }

    public int size() {
        return cells.size();
    }
}
