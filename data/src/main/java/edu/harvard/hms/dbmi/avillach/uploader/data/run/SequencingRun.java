package edu.harvard.hms.dbmi.avillach.uploader.data.run;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * A validated run, ready for upload. Projects keep the order of their first appearance in the
 * sample sheet and samples keep sheet order within their project.
 */
public record SequencingRun(String platform, SampleSheetMetadata metadata, List<Project> projects) {

    public SequencingRun {
        Preconditions.checkNotNull(metadata, "metadata");
        projects = ImmutableList.copyOf(projects);
    }

    public List<Sample> samples() {
        return projects.stream().flatMap(p -> p.samples().stream()).collect(ImmutableList.toImmutableList());
    }

    public int sampleCount() {
        return projects.stream().mapToInt(p -> p.samples().size()).sum();
    }

    public Optional<Project> project(String projectId) {
        return projects.stream().filter(p -> p.projectId().equals(projectId)).findFirst();
    }
}
