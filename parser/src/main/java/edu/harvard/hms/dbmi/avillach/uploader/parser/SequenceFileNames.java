package edu.harvard.hms.dbmi.avillach.uploader.parser;

import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import edu.harvard.hms.dbmi.avillach.uploader.data.directory.DataDirectoryStruct;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.ReadDirection;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequenceFile;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SequenceFileException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches demultiplexed FASTQ files to samples.
 *
 * Files are named {@code <sample>_S<number>[_L<lane>]_R<1|2>_001.fastq[.gz]}, where the number is
 * the sample's position in the sheet. Reverse reads must pair with forward reads lane by lane; a
 * file without a lane forms its own group.
 */
public final class SequenceFileNames {

    private static final Pattern READ_PATTERN = Pattern.compile("^_S\\d+(?:_L(\\d{3}))?_R([12])_\\d{3}\\.fastq(?:\\.gz)?$");

    private static final String NO_LANE = "none";

    private SequenceFileNames() {
    }

    public static boolean isFastq(String fileName) {
        return fileName.endsWith(".fastq") || fileName.endsWith(".fastq.gz");
    }

    /**
     * Picks the files of one sample out of a directory listing.
     *
     * @param sampleName   file name prefix of the sample
     * @param sampleNumber 1-based sheet position of the sample
     * @param subdirectory listing entry the files were taken from
     * @param fileNames    the listing
     * @throws SequenceFileException when nothing matches, a read pair is incomplete, or a
     *                               matching file carries no read number
     */
    public static List<SequenceFile> resolve(String sampleName, int sampleNumber, String subdirectory,
                                             List<String> fileNames, DataDirectoryStruct dataDirectory) throws SequenceFileException {
        String prefix = sampleName + "_S" + sampleNumber + "_";
        List<String> forward = new ArrayList<>();
        List<String> reverse = new ArrayList<>();
        List<String> ambiguous = new ArrayList<>();
        Multiset<String> forwardLanes = TreeMultiset.create();
        Multiset<String> reverseLanes = TreeMultiset.create();

        fileNames.stream()
            .filter(name -> name.startsWith(prefix) && isFastq(name))
            .sorted()
            .forEach(name -> {
                Matcher m = READ_PATTERN.matcher(name.substring(sampleName.length()));
                if (!m.matches()) {
                    ambiguous.add(name);
                    return;
                }
                String lane = m.group(1) != null ? "L" + m.group(1) : NO_LANE;
                if ("1".equals(m.group(2))) {
                    forward.add(name);
                    forwardLanes.add(lane);
                } else {
                    reverse.add(name);
                    reverseLanes.add(lane);
                }
            });

        if (!ambiguous.isEmpty()) {
            throw new SequenceFileException("Can not tell the read direction of " + String.join(", ", ambiguous)
                + " for sample " + sampleName, sampleName);
        }
        if (forward.isEmpty() && reverse.isEmpty()) {
            throw new SequenceFileException("No sequence files found for sample " + sampleName
                + " (expected files starting with " + prefix + ")", sampleName);
        }
        if (!reverse.isEmpty() && !forwardLanes.equals(reverseLanes)) {
            throw new SequenceFileException("Sample " + sampleName + " has forward reads in lanes " + forwardLanes
                + " but reverse reads in lanes " + reverseLanes + ", a read pair is incomplete", sampleName);
        }

        List<SequenceFile> files = new ArrayList<>();
        ReadDirection forwardDirection = reverse.isEmpty() ? ReadDirection.SINGLE : ReadDirection.FORWARD;
        forward.forEach(name -> files.add(new SequenceFile(dataDirectory.resolve(subdirectory, name), forwardDirection)));
        reverse.forEach(name -> files.add(new SequenceFile(dataDirectory.resolve(subdirectory, name), ReadDirection.REVERSE)));
        return files;
    }
}
