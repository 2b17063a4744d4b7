package io.practicedb.core.validation;

import java.util.List;

public record UniqueConstraint(String collection, List<String> fields) {

    public UniqueConstraint {
        fields = List.copyOf(fields);
    }

    public static UniqueConstraint of(String collection, String... fields) {
        return new UniqueConstraint(collection, List.of(fields));
    }

    public String describe() {
        return String.join(", ", fields) + " must be unique";
    }
}
