package edu.harvard.hms.dbmi.avillach.uploader.parser;

import edu.harvard.hms.dbmi.avillach.uploader.data.run.Project;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.Sample;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SampleSheetMetadata;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.exception.SequenceFileException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups parsed samples into projects and assembles the run. Does no I/O, so the same input
 * always gives an equal run.
 */
public class RunModelBuilder {

    /**
     * @throws SequenceFileException if a sample reached this point without any sequence file
     */
    public SequencingRun build(List<Sample> samples, SampleSheetMetadata metadata, String platform) throws SequenceFileException {
        Map<String, List<Sample>> byProject = new LinkedHashMap<>();
        for (Sample sample : samples) {
            if (sample.sequenceFiles().isEmpty()) {
                throw new SequenceFileException("Sample " + sample.sampleName() + " has no sequence files", sample.sampleName());
            }
            byProject.computeIfAbsent(sample.projectId(), k -> new ArrayList<>()).add(sample);
        }

        List<Project> projects = new ArrayList<>();
        byProject.forEach((projectId, projectSamples) -> projects.add(new Project(projectId, projectSamples)));
        return new SequencingRun(platform, metadata, projects);
    }
}
