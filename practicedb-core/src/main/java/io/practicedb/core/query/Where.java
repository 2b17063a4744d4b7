package io.practicedb.core.query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

import io.practicedb.core.Documents;

/**
 * Filters used by queries, counts and bulk deletes.
 */
public final class Where {

    private Where() {
    }

    /**
     * AND of exact-match fields. An empty map matches everything.
     */
    public static Predicate<Map<String, Object>> matching(Map<String, ?> fields) {
        Map<String, Object> expected = new LinkedHashMap<>(fields);
        return document -> {
            for (Map.Entry<String, Object> entry : expected.entrySet()) {
                if (!Documents.valuesEqual(document.get(entry.getKey()), entry.getValue())) {
                    return false;
                }
            }
            return true;
        };
    }

    public static Predicate<Map<String, Object>> fieldEquals(String field, Object value) {
        return document -> Documents.valuesEqual(document.get(field), value);
    }

    public static Predicate<Map<String, Object>> all() {
        return document -> true;
    }
}
