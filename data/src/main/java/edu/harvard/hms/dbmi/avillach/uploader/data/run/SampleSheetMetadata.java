package edu.harvard.hms.dbmi.avillach.uploader.data.run;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run level metadata from the [Header] and [Reads] sections of a sample sheet.
 *
 * Keys are kept in sheet order and use the sheet's own spelling ("Experiment Name", "Workflow").
 */
public record SampleSheetMetadata(Map<String, String> values, List<Integer> readLengths) {

    public static final String EXPERIMENT_NAME = "Experiment Name";
    public static final String WORKFLOW = "Workflow";

    public SampleSheetMetadata {
        values = ImmutableMap.copyOf(values);
        readLengths = ImmutableList.copyOf(readLengths);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * The experiment name doubles as the run id reported to the remote service.
     */
    public Optional<String> runId() {
        return get(EXPERIMENT_NAME);
    }

    public LayoutType layoutType() {
        return readLengths.size() > 1 ? LayoutType.PAIRED_END : LayoutType.SINGLE_END;
    }
}
