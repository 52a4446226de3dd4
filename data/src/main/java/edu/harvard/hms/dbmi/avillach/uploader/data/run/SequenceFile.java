package edu.harvard.hms.dbmi.avillach.uploader.data.run;

import com.google.common.base.Preconditions;

import java.nio.file.Path;

/**
 * One sequence file of a sample.
 */
public record SequenceFile(Path path, ReadDirection direction) {

    public SequenceFile {
        Preconditions.checkNotNull(path, "path");
        Preconditions.checkNotNull(direction, "direction");
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
