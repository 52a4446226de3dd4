package edu.harvard.hms.dbmi.avillach.uploader.data.run;

import com.google.common.collect.ImmutableList;

import java.util.List;

public record Project(String projectId, List<Sample> samples) {

    public Project {
        samples = ImmutableList.copyOf(samples);
    }
}
