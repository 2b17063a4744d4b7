package io.practicedb.core.validation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.Documents;
import io.practicedb.core.schema.SchemaRegistry;
import io.practicedb.core.schema.ValidationResult;

/**
 * Validated writes: schema, then uniqueness, then references and business rules, then the engine
 * mutation. The first failure is thrown and nothing is written.
 */
public class ValidationManager implements Validator {
    private static final Logger LOGGER = Logger.getLogger(ValidationManager.class.getName());

    private final DatabaseEngine engine;
    private final SchemaRegistry schemas;
    private final IntegrityRules rules;
    private final ReferentialIntegrity references;
    private final BusinessRules businessRules;

    public ValidationManager(DatabaseEngine engine, SchemaRegistry schemas, IntegrityRules rules) {
        this.engine = engine;
        this.schemas = schemas;
        this.rules = rules;
        this.references = new ReferentialIntegrity(engine, rules);
        this.businessRules = new BusinessRules(engine);
    }

    public Map<String, Object> createValidated(String collection, Map<String, Object> data) throws IOException {
        ValidationResult result = schemas.validate(collection, data);
        if (!result.isValid()) {
            throw ValidationException.of(result.errors());
        }
        Map<String, Object> document = result.value();
        validate(collection, document, null);
        return engine.create(collection, document);
    }

    /**
     * Validates {@code patch} against the partial schema, then checks the rules against the merged
     * document.
     *
     * @return the updated document, or null when the id does not exist
     */
    public Map<String, Object> updateValidated(String collection, String id, Map<String, Object> patch)
            throws IOException {
        ValidationResult result = schemas.validatePartial(collection, patch);
        if (!result.isValid()) {
            throw ValidationException.of(result.errors());
        }
        Map<String, Object> changes = result.value();
        Map<String, Object> existing = engine.get(collection, id);
        if (existing == null) {
            return null;
        }
        Map<String, Object> merged = Documents.copy(existing);
        merged.putAll(changes);
        merged.put(Documents.ID, id);

        throwOnUniqueViolations(collection, merged, id, changes.keySet());
        references.checkForeignKeys(collection, merged, changes.keySet());
        businessRules.apply(collection, merged, id);
        return engine.update(collection, id, changes);
    }

    public boolean deleteValidated(String collection, String id) throws IOException {
        validateDelete(collection, id);
        references.handleDeleteCascade(collection, id);
        boolean deleted = engine.delete(collection, id);
        if (deleted) {
            LOGGER.fine(() -> "Deleted " + collection + "/" + id + " after integrity checks");
        }
        return deleted;
    }

    @Override
    public void validate(String collection, Map<String, Object> document, String excludeId) throws IOException {
        throwOnUniqueViolations(collection, document, excludeId, null);
        references.checkForeignKeys(collection, document, null);
        businessRules.apply(collection, document, excludeId);
    }

    @Override
    public void validateDelete(String collection, String id) throws IOException {
        DeleteCheck check = references.checkDeleteConstraints(collection, id);
        if (!check.canDelete()) {
            throw IntegrityException.blocked(check.blockedBy());
        }
    }

    /**
     * Messages for every unique constraint {@code data} would break. Constraints with a null or
     * missing value are skipped, as is the document {@code excludeId}.
     */
    public List<String> checkUniqueConstraints(String collection, Map<String, Object> data, String excludeId)
            throws IOException {
        return uniqueViolations(collection, data, excludeId, null);
    }

    public ReferentialIntegrity getReferences() {
        return references;
    }

    public BusinessRules getBusinessRules() {
        return businessRules;
    }

    public IntegrityRules getRules() {
        return rules;
    }

    private void throwOnUniqueViolations(String collection, Map<String, Object> data, String excludeId,
            Iterable<String> touchedFields) throws IOException {
        List<String> violations = uniqueViolations(collection, data, excludeId, touchedFields);
        if (!violations.isEmpty()) {
            throw IntegrityException.unique(violations);
        }
    }

    private List<String> uniqueViolations(String collection, Map<String, Object> data, String excludeId,
            Iterable<String> touchedFields) throws IOException {
        List<String> violations = new ArrayList<>();
        List<UniqueConstraint> constraints = rules.uniqueConstraintsFor(collection);
        if (constraints.isEmpty()) {
            return violations;
        }
        List<Map<String, Object>> documents = engine.getAll(collection);
        for (UniqueConstraint constraint : constraints) {
            if (touchedFields != null && !touches(constraint, touchedFields)) {
                continue;
            }
            if (hasMissingValue(constraint, data)) {
                continue;
            }
            for (Map<String, Object> other : documents) {
                if (Objects.equals(Documents.idOf(other), excludeId)) {
                    continue;
                }
                if (sameTuple(constraint, data, other)) {
                    violations.add(constraint.describe());
                    break;
                }
            }
        }
        return violations;
    }

    private static boolean touches(UniqueConstraint constraint, Iterable<String> fields) {
        for (String field : fields) {
            if (constraint.fields().contains(field)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasMissingValue(UniqueConstraint constraint, Map<String, Object> data) {
        for (String field : constraint.fields()) {
            if (data.get(field) == null) {
                return true;
            }
        }
        return false;
    }

    static boolean sameTuple(UniqueConstraint constraint, Map<String, Object> a, Map<String, Object> b) {
        for (String field : constraint.fields()) {
            if (!Documents.valuesEqual(a.get(field), b.get(field))) {
                return false;
            }
        }
        return true;
    }
}
