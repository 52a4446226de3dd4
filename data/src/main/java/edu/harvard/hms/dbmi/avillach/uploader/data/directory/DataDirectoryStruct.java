package edu.harvard.hms.dbmi.avillach.uploader.data.directory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Listing of a run's data directory, keyed by subdirectory name.
 *
 * Lets sequence files be resolved without touching the filesystem: cloud deployments build the
 * listing themselves, local runs get one from a single directory walk. Flat layouts put their
 * files under {@link #ROOT}.
 */
public class DataDirectoryStruct {

    public static final String ROOT = "";

    private final Path dataDirectory;
    private final ImmutableMap<String, ImmutableList<String>> entries;

    private DataDirectoryStruct(Path dataDirectory, Map<String, ImmutableList<String>> entries) {
        this.dataDirectory = dataDirectory;
        this.entries = ImmutableMap.copyOf(entries);
    }

    public static Builder builder(Path dataDirectory) {
        return new Builder(dataDirectory);
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Set<String> getSubdirectories() {
        return entries.keySet();
    }

    public Optional<List<String>> getFiles(String subdirectory) {
        return Optional.ofNullable(entries.get(subdirectory));
    }

    /**
     * @return where a listed file lives on the data directory's filesystem
     */
    public Path resolve(String subdirectory, String fileName) {
        return ROOT.equals(subdirectory) ? dataDirectory.resolve(fileName) : dataDirectory.resolve(subdirectory).resolve(fileName);
    }

    @Override
    public String toString() {
        return "DataDirectoryStruct{" + dataDirectory + ", " + entries + "}";
    }

    public static class Builder {
        private final Path dataDirectory;
        private final Map<String, ImmutableList<String>> entries = new LinkedHashMap<>();

        private Builder(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        public Builder add(String subdirectory, List<String> files) {
            entries.put(subdirectory, ImmutableList.copyOf(files));
            return this;
        }

        public DataDirectoryStruct build() {
            return new DataDirectoryStruct(dataDirectory, entries);
        }
    }
}
