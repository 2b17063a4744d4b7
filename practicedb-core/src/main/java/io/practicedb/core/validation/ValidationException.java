package io.practicedb.core.validation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.practicedb.core.PracticeDbException;
import io.practicedb.core.schema.FieldError;

/**
 * A schema violation or a failed business rule. {@code field} names the rule's subject when there
 * is a single one, e.g. {@code time} for appointment overlaps.
 */
public class ValidationException extends PracticeDbException {

    private final String field;
    private final Map<String, Object> details;
    private final List<FieldError> fieldErrors;

    public ValidationException(String message, String field) {
        this(message, field, Collections.emptyMap(), Collections.emptyList());
    }

    public ValidationException(String message, String field, Map<String, Object> details, List<FieldError> fieldErrors) {
        super(message);
        this.field = field;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
        this.fieldErrors = fieldErrors == null ? Collections.emptyList() : List.copyOf(fieldErrors);
    }

    public static ValidationException of(List<FieldError> errors) {
        StringBuilder message = new StringBuilder();
        for (FieldError error : errors) {
            if (message.length() > 0) {
                message.append("; ");
            }
            message.append(error);
        }
        return new ValidationException(message.toString(), null, Collections.emptyMap(), errors);
    }

    public String getField() {
        return field;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public List<FieldError> getFieldErrors() {
        return fieldErrors;
    }
}
