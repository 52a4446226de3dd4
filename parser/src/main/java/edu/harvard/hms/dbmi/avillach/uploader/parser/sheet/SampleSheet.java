package edu.harvard.hms.dbmi.avillach.uploader.parser.sheet;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A sample sheet split into its bracketed sections ([Header], [Reads], [Settings], [Data]).
 * Section lookup ignores case.
 */
public class SampleSheet {

    public static final String HEADER = "Header";
    public static final String READS = "Reads";
    public static final String SETTINGS = "Settings";
    public static final String DATA = "Data";

    private final Path path;
    private final Map<String, List<SheetLine>> sections;

    SampleSheet(Path path, Map<String, List<SheetLine>> sections) {
        this.path = path;
        this.sections = new LinkedHashMap<>();
        sections.forEach((name, lines) -> this.sections.put(name.toLowerCase(Locale.ROOT), ImmutableList.copyOf(lines)));
    }

    public Path getPath() {
        return path;
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Optional<List<SheetLine>> getSection(String name) {
        return Optional.ofNullable(sections.get(name.toLowerCase(Locale.ROOT)));
    }

    public Set<String> getSectionNames() {
        return sections.keySet();
    }
}
