package io.practicedb.core.schema;

/**
 * A failed check at a dotted field path, e.g. {@code emergencyContact.phone} or {@code services[0].quantity}.
 */
public record FieldError(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
