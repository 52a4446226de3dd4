package edu.harvard.hms.dbmi.avillach.uploader.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered accumulation of {@link ValidationError}s.
 *
 * Validation stages append to a result instead of stopping at the first problem; callers consult
 * {@link #isValid()} once the stage is over. Results from different stages are combined with
 * {@link #addAll(ValidationResult)}, never replaced.
 */
public class ValidationResult {

    private final List<ValidationError> errors = new ArrayList<>();

    public ValidationResult() {
    }

    public static ValidationResult of(ValidationError... errors) {
        ValidationResult result = new ValidationResult();
        for (ValidationError error : errors) {
            result.addError(error);
        }
        return result;
    }

    public ValidationResult addError(ValidationError error) {
        errors.add(error);
        return this;
    }

    public ValidationResult addError(ErrorKind kind, String message, String entity) {
        return addError(new ValidationError(kind, message, entity));
    }

    public ValidationResult addAll(ValidationResult other) {
        errors.addAll(other.errors);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long count(ErrorKind kind) {
        return errors.stream().filter(e -> e.kind() == kind).count();
    }

    @Override
    public String toString() {
        return "ValidationResult{" + errorCount() + " errors: " + errors + "}";
    }
}
