package io.practicedb.core.validation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.practicedb.core.PracticeDbException;

/**
 * A unique or referential constraint violation.
 */
public class IntegrityException extends PracticeDbException {
    public static final String UNIQUE = "unique";
    public static final String FOREIGN_KEY = "foreign_key";

    private final String constraint;
    private final List<String> blockedBy;
    private final List<String> violations;
    private final Map<String, Object> details;

    public IntegrityException(String message, String constraint, List<String> blockedBy, List<String> violations,
            Map<String, Object> details) {
        super(message);
        this.constraint = constraint;
        this.blockedBy = blockedBy == null ? Collections.emptyList() : List.copyOf(blockedBy);
        this.violations = violations == null ? Collections.emptyList() : List.copyOf(violations);
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
    }

    public static IntegrityException unique(List<String> violations) {
        return new IntegrityException(String.join("; ", violations), UNIQUE, null, violations, null);
    }

    public static IntegrityException blocked(List<String> blockedBy) {
        return new IntegrityException("Cannot delete: referenced by " + String.join(", ", blockedBy), FOREIGN_KEY,
                blockedBy, null, null);
    }

    public static IntegrityException missingReference(ReferenceConstraint reference, Object value) {
        return new IntegrityException("Referenced " + reference.targetCollection() + " document " + value
                + " not found", FOREIGN_KEY, null, null, Map.of(reference.sourceField(), value));
    }

    /**
     * {@link #UNIQUE} or {@link #FOREIGN_KEY}.
     */
    public String getConstraint() {
        return constraint;
    }

    /**
     * Collections holding restrict references that blocked a delete.
     */
    public List<String> getBlockedBy() {
        return blockedBy;
    }

    public List<String> getViolations() {
        return violations;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
