package edu.harvard.hms.dbmi.avillach.uploader.parser.sheet;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Illumina style sample sheets.
 *
 * Each line is parsed on its own so errors can point at an exact line number. Blank lines are
 * skipped and a line whose first cell is {@code [Name]} opens a section. Lines before the first
 * section are ignored.
 */
public class SampleSheetReader {
    private static final Logger log = LoggerFactory.getLogger(SampleSheetReader.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[(.+)]$");

    private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT
        .builder()
        .setQuote('"')
        .setTrim(true)
        .setIgnoreSurroundingSpaces(true)
        .build();

    public SampleSheet read(Path sampleSheet) throws IOException {
        Map<String, List<SheetLine>> sections = new LinkedHashMap<>();
        List<SheetLine> current = null;
        long lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(sampleSheet, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String content = lineNumber == 1 ? stripByteOrderMark(line) : line;
                List<String> cells;
                try {
                    cells = parseLine(content);
                } catch (IOException | UncheckedIOException e) {
                    throw new IOException("Malformed line " + lineNumber + " in " + sampleSheet + ": " + line, e);
                }
                if (cells.isEmpty()) {
                    continue;
                }

                Matcher section = SECTION_PATTERN.matcher(cells.get(0));
                if (section.matches()) {
                    current = new ArrayList<>();
                    sections.put(section.group(1).trim(), current);
                    continue;
                }

                if (current == null) {
                    log.debug("Ignoring line {} of {}, it is outside any section", lineNumber, sampleSheet.getFileName());
                    continue;
                }
                current.add(new SheetLine(lineNumber, cells, content));
            }
        }

        log.debug("Read sections {} from {}", sections.keySet(), sampleSheet);
        return new SampleSheet(sampleSheet, sections);
    }

    /**
     * @return the cells of the line without trailing empty cells; empty for blank lines
     */
    static List<String> parseLine(String line) throws IOException {
        if (line.isBlank()) {
            return List.of();
        }
        List<String> cells = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(line, LINE_FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (records.hasNext()) {
                records.next().forEach(cells::add);
            }
        }
        int end = cells.size();
        while (end > 0 && cells.get(end - 1).isEmpty()) {
            end--;
        }
        return cells.subList(0, end);
    }

    private static String stripByteOrderMark(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
