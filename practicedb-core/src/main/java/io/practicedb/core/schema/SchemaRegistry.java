package io.practicedb.core.schema;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import io.practicedb.core.Documents;

/**
 * Structural validators per collection. Collections without a registered schema accept any document.
 */
public class SchemaRegistry {

    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

    public static SchemaRegistry withDefaults() {
        SchemaRegistry registry = new SchemaRegistry();
        PracticeSchemas.registerAll(registry);
        return registry;
    }

    public SchemaRegistry register(String collection, Schema schema) {
        schemas.put(collection, schema);
        return this;
    }

    public Schema getSchema(String collection) {
        return schemas.get(collection);
    }

    public boolean hasSchema(String collection) {
        return schemas.containsKey(collection);
    }

    public Set<String> getCollections() {
        return new TreeSet<>(schemas.keySet());
    }

    public ValidationResult validate(String collection, Map<String, Object> document) {
        Schema schema = schemas.get(collection);
        return schema == null ? ValidationResult.valid(Documents.copy(document)) : schema.validate(document);
    }

    public ValidationResult validatePartial(String collection, Map<String, Object> patch) {
        Schema schema = schemas.get(collection);
        return schema == null ? ValidationResult.valid(Documents.copy(patch)) : schema.validatePartial(patch);
    }
}
