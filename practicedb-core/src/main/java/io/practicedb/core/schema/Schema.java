package io.practicedb.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of named {@link FieldSpec}s describing one object shape. Fields the shape does not
 * declare are dropped from the normalized value.
 */
public final class Schema {

    private final Map<String, FieldSpec> fields;

    private Schema(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, FieldSpec> getFields() {
        return fields;
    }

    public ValidationResult validate(Map<String, Object> document) {
        return run(document, false);
    }

    /**
     * Same checks with every top-level field optional, for patches.
     */
    public ValidationResult validatePartial(Map<String, Object> document) {
        return run(document, true);
    }

    private ValidationResult run(Map<String, Object> document, boolean partial) {
        List<FieldError> errors = new ArrayList<>();
        Map<String, Object> value = check("", document, partial, errors);
        return errors.isEmpty() ? ValidationResult.valid(value) : ValidationResult.invalid(errors);
    }

    Map<String, Object> check(String prefix, Map<String, Object> source, boolean partial, List<FieldError> errors) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, FieldSpec> field : fields.entrySet()) {
            String name = field.getKey();
            if (!source.containsKey(name)) {
                if (!partial && !field.getValue().isOptional()) {
                    errors.add(new FieldError(prefix + name, "Required"));
                }
                continue;
            }
            Object value = source.get(name);
            if (partial && value == null) {
                normalized.put(name, null);
                continue;
            }
            normalized.put(name, field.getValue().check(prefix + name, value, errors));
        }
        return normalized;
    }

    public static final class Builder {
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        public Builder field(String name, FieldSpec spec) {
            fields.put(name, spec);
            return this;
        }

        public Schema build() {
            return new Schema(fields);
        }
    }
}
