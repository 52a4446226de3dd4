package edu.harvard.hms.dbmi.avillach.uploader.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the per-directory upload status marker.
 *
 * The marker is the only durable record of upload progress. It is replaced through a temp file
 * and a rename, so a crash mid-write leaves the previous marker (or none) rather than a truncated
 * one.
 */
public class StatusStore {
    private static final Logger log = LoggerFactory.getLogger(StatusStore.class);

    public static final String STATUS_FILE_NAME = "upload_status.info";

    private final ObjectMapper mapper;
    private final Clock clock;

    public StatusStore() {
        this(Clock.systemUTC());
    }

    public StatusStore(Clock clock) {
        this.clock = clock;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void writeStatus(Path directory, DirectoryStatus status) throws DirectoryException {
        writeStatus(directory, status, null);
    }

    /**
     * Replaces the marker in {@code directory} with {@code status}.
     *
     * @throws DirectoryException       if the directory is missing or the marker cannot be written
     * @throws IllegalArgumentException for NEW and INVALID, which are never persisted
     */
    public void writeStatus(Path directory, DirectoryStatus status, String message) throws DirectoryException {
        if (!status.isPersistable()) {
            throw new IllegalArgumentException("Status " + status + " is derived and cannot be written");
        }
        if (!Files.isDirectory(directory)) {
            throw new DirectoryException("Directory does not exist, can not write status file: " + directory, directory);
        }
        if (!Files.isWritable(directory)) {
            throw new DirectoryException("Directory is not writable, can not write status file: " + directory, directory);
        }

        byte[] content;
        try {
            content = mapper.writeValueAsBytes(new StatusMarker(status.token(), clock.instant(), message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize status marker", e);
        }

        Path marker = directory.resolve(STATUS_FILE_NAME);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + STATUS_FILE_NAME, ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, marker, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing marker directly", directory);
                Files.move(temp, marker, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(temp);
            throw new DirectoryException("Could not write status file to directory " + directory + ": " + e.getMessage(), directory, e);
        }
        log.info("Directory {} marked as {}", directory, status);
    }

    /**
     * @return NEW when there is no marker, ERROR when the marker is unreadable, otherwise the stored status
     */
    public DirectoryStatus readStatus(Path directory) throws DirectoryException {
        return readRunDirectory(directory).status();
    }

    /**
     * Reads the raw marker, if one exists.
     */
    public Optional<StatusMarker> readMarker(Path directory) throws DirectoryException {
        Path marker = directory.resolve(STATUS_FILE_NAME);
        if (!Files.exists(marker)) {
            return Optional.empty();
        }
        try {
            StatusMarker stored = mapper.readValue(marker.toFile(), StatusMarker.class);
            if (stored == null) {
                log.warn("Status file {} holds no marker", marker);
                return Optional.of(new StatusMarker(null, null, "Status file holds no marker"));
            }
            return Optional.of(stored);
        } catch (JsonProcessingException e) {
            log.warn("Status file {} is corrupt: {}", marker, e.getOriginalMessage());
            return Optional.of(new StatusMarker(null, null, "Status file is corrupt: " + e.getOriginalMessage()));
        } catch (IOException e) {
            throw new DirectoryException("Could not read status file " + marker + ": " + e.getMessage(), directory, e);
        }
    }

    /**
     * Classifies a directory: INVALID when any of {@code requiredFiles} is missing (the marker is
     * not consulted, let alone overwritten), otherwise the persisted status.
     */
    public RunDirectory getDirectoryStatus(Path directory, List<String> requiredFiles) throws DirectoryException {
        List<String> missing = new ArrayList<>();
        for (String requiredFile : requiredFiles) {
            if (!Files.exists(directory.resolve(requiredFile))) {
                missing.add(requiredFile);
            }
        }
        if (!missing.isEmpty()) {
            return new RunDirectory(directory, false, DirectoryStatus.INVALID,
                "Missing required files: " + String.join(", ", missing));
        }
        return readRunDirectory(directory);
    }

    private RunDirectory readRunDirectory(Path directory) throws DirectoryException {
        Optional<StatusMarker> marker = readMarker(directory);
        if (marker.isEmpty()) {
            return new RunDirectory(directory, true, DirectoryStatus.NEW, null);
        }
        StatusMarker stored = marker.get();
        if (stored.status() == null) {
            return new RunDirectory(directory, true, DirectoryStatus.ERROR,
                stored.message() != null ? stored.message() : "Status file has no status");
        }
        try {
            DirectoryStatus status = DirectoryStatus.fromToken(stored.status());
            if (!status.isPersistable()) {
                return new RunDirectory(directory, true, DirectoryStatus.ERROR,
                    "Status file holds a status that is never written: " + stored.status());
            }
            return new RunDirectory(directory, true, status, stored.message());
        } catch (IllegalArgumentException e) {
            return new RunDirectory(directory, true, DirectoryStatus.ERROR,
                "Status file holds an unknown status: " + stored.status());
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary status file {}", temp, e);
        }
    }
}
