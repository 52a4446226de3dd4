package edu.harvard.hms.dbmi.avillach.uploader.data.run;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A sample of a run and the sequence files resolved for it.
 *
 * @param sampleName    identifier of the sample within its project, used as the remote sample name
 * @param sampleId      the Sample_ID column of the sheet
 * @param projectId     identifier of the remote project the sample belongs to
 * @param sampleNumber  1-based position in the sheet, part of instrument file names
 * @param description   free text, may be empty
 * @param sequenceFiles forward files first, then reverse files, each in lane order
 */
public record Sample(
    String sampleName,
    String sampleId,
    String projectId,
    int sampleNumber,
    String description,
    List<SequenceFile> sequenceFiles
) {
    public Sample {
        Preconditions.checkArgument(sampleName != null && !sampleName.isBlank(), "sample name is required");
        Preconditions.checkArgument(projectId != null && !projectId.isBlank(), "project id is required");
        description = description == null ? "" : description;
        sequenceFiles = ImmutableList.copyOf(sequenceFiles);
    }

    public boolean isPairedEnd() {
        return sequenceFiles.stream().anyMatch(f -> f.direction() == ReadDirection.FORWARD)
            && sequenceFiles.stream().anyMatch(f -> f.direction() == ReadDirection.REVERSE);
    }

    public List<SequenceFile> filesFor(ReadDirection direction) {
        return sequenceFiles.stream().filter(f -> f.direction() == direction).collect(ImmutableList.toImmutableList());
    }
}
