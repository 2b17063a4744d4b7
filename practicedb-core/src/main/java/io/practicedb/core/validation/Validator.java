package io.practicedb.core.validation;

import java.io.IOException;
import java.util.Map;

public interface Validator {

    /**
     * Checks uniqueness, references and business rules for a complete document.
     *
     * @param excludeId id of the document being replaced, or null for inserts
     */
    void validate(String collection, Map<String, Object> document, String excludeId) throws IOException;

    void validateDelete(String collection, String id) throws IOException;
}
