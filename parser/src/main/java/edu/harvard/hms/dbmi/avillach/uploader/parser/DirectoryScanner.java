package edu.harvard.hms.dbmi.avillach.uploader.parser;

import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.progress.DirectoryStatus;
import edu.harvard.hms.dbmi.avillach.uploader.progress.RunDirectory;
import edu.harvard.hms.dbmi.avillach.uploader.progress.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds run directories under a root and classifies each with the parser's required files.
 */
public class DirectoryScanner {
    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final SampleSheetParser parser;
    private final StatusStore statusStore;

    public DirectoryScanner(SampleSheetParser parser, StatusStore statusStore) {
        this.parser = parser;
        this.statusStore = statusStore;
    }

    /**
     * Classifies every immediate child directory of {@code root}, in name order. A child whose
     * marker cannot be read is reported as ERROR rather than failing the scan.
     *
     * @throws DirectoryException if {@code root} is not a readable directory
     */
    public List<RunDirectory> findRuns(Path root) throws DirectoryException {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new DirectoryException("Directory " + root + " does not exist or is not readable", root);
        }

        List<Path> children;
        try (Stream<Path> entries = Files.list(root)) {
            children = entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new DirectoryException("Could not list directory " + root + ": " + e.getMessage(), root, e);
        }

        List<RunDirectory> runs = new ArrayList<>();
        for (Path child : children) {
            try {
                runs.add(findSingleRun(child));
            } catch (DirectoryException e) {
                log.warn("Could not read status of {}: {}", child, e.getMessage());
                runs.add(new RunDirectory(child, true, DirectoryStatus.ERROR, e.getMessage()));
            }
        }
        log.info("Found {} directories in {}", runs.size(), root);
        return runs;
    }

    public RunDirectory findSingleRun(Path directory) throws DirectoryException {
        RunDirectory run = statusStore.getDirectoryStatus(directory, parser.getRequiredFileList());
        log.debug("{} is {}", directory, run.status());
        return run;
    }

    /**
     * @return the first directory, in name order, that is NEW and has all required files
     */
    public Optional<RunDirectory> findFirstNewRun(Path root) throws DirectoryException {
        Optional<RunDirectory> first = findRuns(root).stream().filter(RunDirectory::isNew).findFirst();
        if (first.isEmpty()) {
            log.info("No new sequencing runs found in {}", root);
        }
        return first;
    }
}
