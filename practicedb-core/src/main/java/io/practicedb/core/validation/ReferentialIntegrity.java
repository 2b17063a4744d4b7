package io.practicedb.core.validation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.query.Where;

/**
 * Enforces {@link ReferenceConstraint}s: existence checks on write, restrict checks and
 * cascade or set-null side effects on delete.
 */
public class ReferentialIntegrity {
    private static final Logger LOGGER = Logger.getLogger(ReferentialIntegrity.class.getName());

    private final DatabaseEngine engine;
    private final IntegrityRules rules;

    public ReferentialIntegrity(DatabaseEngine engine, IntegrityRules rules) {
        this.engine = engine;
        this.rules = rules;
    }

    public boolean checkReferenceExists(String collection, String id) throws IOException {
        return id != null && engine.get(collection, id) != null;
    }

    /**
     * Verifies every non-null reference {@code document} holds. With {@code onlyFields} set, only
     * references stored in those fields are checked.
     *
     * @throws IntegrityException for the first reference whose target is missing
     */
    public void checkForeignKeys(String collection, Map<String, Object> document, Iterable<String> onlyFields)
            throws IOException {
        for (ReferenceConstraint reference : rules.referencesFrom(collection)) {
            if (onlyFields != null && !contains(onlyFields, reference.sourceField())) {
                continue;
            }
            Object value = document.get(reference.sourceField());
            if (value == null) {
                continue;
            }
            if (!checkReferenceExists(reference.targetCollection(), String.valueOf(value))) {
                throw IntegrityException.missingReference(reference, value);
            }
        }
    }

    public DeleteCheck checkDeleteConstraints(String collection, String id) throws IOException {
        List<String> blockedBy = new ArrayList<>();
        for (ReferenceConstraint reference : rules.referencesTo(collection)) {
            if (reference.onDelete() != OnDelete.RESTRICT || blockedBy.contains(reference.sourceCollection())) {
                continue;
            }
            if (engine.count(reference.sourceCollection(), Where.fieldEquals(reference.sourceField(), id)) > 0) {
                blockedBy.add(reference.sourceCollection());
            }
        }
        return new DeleteCheck(blockedBy.isEmpty(), blockedBy);
    }

    /**
     * Applies cascade and set-null policies for documents referencing {@code collection/id}.
     */
    public void handleDeleteCascade(String collection, String id) throws IOException {
        for (ReferenceConstraint reference : rules.referencesTo(collection)) {
            switch (reference.onDelete()) {
                case CASCADE:
                    int removed = engine.deleteMany(reference.sourceCollection(),
                            Where.fieldEquals(reference.sourceField(), id));
                    if (removed > 0) {
                        LOGGER.fine(() -> "Cascade deleted " + removed + " " + reference.sourceCollection()
                                + " referencing " + collection + "/" + id);
                    }
                    break;
                case SET_NULL:
                    Map<String, Object> patch = new HashMap<>();
                    patch.put(reference.sourceField(), null);
                    engine.updateWhere(reference.sourceCollection(), Where.fieldEquals(reference.sourceField(), id),
                            patch);
                    break;
                case RESTRICT:
                default:
                    break;
            }
        }
    }

    private static boolean contains(Iterable<String> fields, String field) {
        for (String candidate : fields) {
            if (candidate.equals(field)) {
                return true;
            }
        }
        return false;
    }
}
