package io.practicedb.core.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import io.practicedb.core.Documents;

/**
 * Declarative check for one field value. Instances are immutable; modifiers return copies.
 */
public final class FieldSpec {
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public enum Type {
        STRING, NUMBER, BOOLEAN, ENUM, LITERAL, OBJECT, ARRAY, RECORD, ANY
    }

    private final Type type;
    private final boolean optional;
    private final Double min;
    private final Double max;
    private final Integer minLength;
    private final boolean email;
    private final Set<String> allowed;
    private final Object literal;
    private final Schema shape;
    private final FieldSpec element;

    private FieldSpec(Type type, boolean optional, Double min, Double max, Integer minLength, boolean email,
            Set<String> allowed, Object literal, Schema shape, FieldSpec element) {
        this.type = type;
        this.optional = optional;
        this.min = min;
        this.max = max;
        this.minLength = minLength;
        this.email = email;
        this.allowed = allowed;
        this.literal = literal;
        this.shape = shape;
        this.element = element;
    }

    private FieldSpec(Type type) {
        this(type, false, null, null, null, false, Collections.emptySet(), null, null, null);
    }

    public static FieldSpec string() {
        return new FieldSpec(Type.STRING);
    }

    public static FieldSpec number() {
        return new FieldSpec(Type.NUMBER);
    }

    public static FieldSpec bool() {
        return new FieldSpec(Type.BOOLEAN);
    }

    public static FieldSpec any() {
        return new FieldSpec(Type.ANY);
    }

    public static FieldSpec enumOf(String... values) {
        return new FieldSpec(Type.ENUM, false, null, null, null, false,
                Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values))), null, null, null);
    }

    public static FieldSpec literal(Object value) {
        return new FieldSpec(Type.LITERAL, false, null, null, null, false, Collections.emptySet(), value, null, null);
    }

    public static FieldSpec object(Schema shape) {
        return new FieldSpec(Type.OBJECT, false, null, null, null, false, Collections.emptySet(), null, shape, null);
    }

    public static FieldSpec arrayOf(FieldSpec element) {
        return new FieldSpec(Type.ARRAY, false, null, null, null, false, Collections.emptySet(), null, null, element);
    }

    public static FieldSpec recordOf(FieldSpec element) {
        return new FieldSpec(Type.RECORD, false, null, null, null, false, Collections.emptySet(), null, null, element);
    }

    public FieldSpec optional() {
        return new FieldSpec(type, true, min, max, minLength, email, allowed, literal, shape, element);
    }

    public FieldSpec min(double value) {
        return new FieldSpec(type, optional, value, max, minLength, email, allowed, literal, shape, element);
    }

    public FieldSpec max(double value) {
        return new FieldSpec(type, optional, min, value, minLength, email, allowed, literal, shape, element);
    }

    public FieldSpec minLength(int value) {
        return new FieldSpec(type, optional, min, max, value, email, allowed, literal, shape, element);
    }

    public FieldSpec email() {
        return new FieldSpec(type, optional, min, max, minLength, true, allowed, literal, shape, element);
    }

    public Type getType() {
        return type;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * Checks {@code value}, appending failures to {@code errors}.
     *
     * @return the normalized value; nested objects lose fields their shape does not declare
     */
    @SuppressWarnings("unchecked")
    Object check(String path, Object value, List<FieldError> errors) {
        if (value == null) {
            if (!optional) {
                errors.add(new FieldError(path, "Required"));
            }
            return null;
        }
        switch (type) {
            case STRING:
                if (!(value instanceof String)) {
                    errors.add(new FieldError(path, "Expected string"));
                    return value;
                }
                String text = (String) value;
                if (minLength != null && text.length() < minLength) {
                    errors.add(new FieldError(path, "Must contain at least " + minLength + " character(s)"));
                }
                if (email && !EMAIL.matcher(text).matches()) {
                    errors.add(new FieldError(path, "Invalid email"));
                }
                return text;
            case NUMBER:
                if (!(value instanceof Number)) {
                    errors.add(new FieldError(path, "Expected number"));
                    return value;
                }
                double number = ((Number) value).doubleValue();
                if (min != null && number < min) {
                    errors.add(new FieldError(path, "Must be greater than or equal to " + format(min)));
                }
                if (max != null && number > max) {
                    errors.add(new FieldError(path, "Must be less than or equal to " + format(max)));
                }
                return value;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    errors.add(new FieldError(path, "Expected boolean"));
                }
                return value;
            case ENUM:
                if (!(value instanceof String) || !allowed.contains(value)) {
                    errors.add(new FieldError(path, "Expected one of " + allowed + ", received '" + value + "'"));
                }
                return value;
            case LITERAL:
                if (!Documents.valuesEqual(literal, value)) {
                    errors.add(new FieldError(path, "Expected '" + literal + "'"));
                }
                return value;
            case OBJECT:
                if (!(value instanceof Map)) {
                    errors.add(new FieldError(path, "Expected object"));
                    return value;
                }
                return shape.check(path + ".", (Map<String, Object>) value, false, errors);
            case ARRAY:
                if (!(value instanceof List)) {
                    errors.add(new FieldError(path, "Expected array"));
                    return value;
                }
                List<Object> items = new ArrayList<>();
                List<Object> source = (List<Object>) value;
                for (int i = 0; i < source.size(); i++) {
                    items.add(element.check(path + "[" + i + "]", source.get(i), errors));
                }
                return items;
            case RECORD:
                if (!(value instanceof Map)) {
                    errors.add(new FieldError(path, "Expected object"));
                    return value;
                }
                Map<String, Object> entries = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                    entries.put(entry.getKey(), element.check(path + "." + entry.getKey(), entry.getValue(), errors));
                }
                return entries;
            case ANY:
            default:
                return Documents.deepCopy(value);
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
