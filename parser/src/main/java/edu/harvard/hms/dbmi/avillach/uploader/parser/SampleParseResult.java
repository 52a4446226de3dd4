package edu.harvard.hms.dbmi.avillach.uploader.parser;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.Sample;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;

import java.util.List;

/**
 * Samples whose files could be resolved, plus the errors for those that could not.
 */
public record SampleParseResult(List<Sample> samples, ValidationResult validationResult) {

    public SampleParseResult {
        samples = ImmutableList.copyOf(samples);
    }

    public boolean isValid() {
        return validationResult.isValid();
    }
}
