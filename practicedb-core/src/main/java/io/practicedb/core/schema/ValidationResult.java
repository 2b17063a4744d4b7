package io.practicedb.core.schema;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a schema check: the normalized document when valid, otherwise the field errors.
 */
public record ValidationResult(Map<String, Object> value, List<FieldError> errors) {

    public ValidationResult {
        errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public static ValidationResult valid(Map<String, Object> value) {
        return new ValidationResult(value, null);
    }

    public static ValidationResult invalid(List<FieldError> errors) {
        return new ValidationResult(null, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
