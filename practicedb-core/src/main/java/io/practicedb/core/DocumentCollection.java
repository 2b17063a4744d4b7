package io.practicedb.core;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import io.practicedb.core.event.CollectionListener;
import io.practicedb.core.event.Subscription;
import io.practicedb.core.query.AggregateResult;
import io.practicedb.core.query.AggregateSpec;
import io.practicedb.core.query.QueryOptions;
import io.practicedb.core.query.QueryResult;
import io.practicedb.core.validation.ValidationManager;

/**
 * One collection of a {@link PracticeDb}. The plain methods write straight to the engine; the
 * {@code Validated} variants run schema, integrity and business checks first.
 */
public class DocumentCollection {
    private final String name;
    private final DatabaseEngine engine;
    private final ValidationManager validator;

    DocumentCollection(String name, DatabaseEngine engine, ValidationManager validator) {
        this.name = name;
        this.engine = engine;
        this.validator = validator;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> create(Map<String, Object> data) throws IOException {
        return engine.create(name, data);
    }

    public Map<String, Object> createValidated(Map<String, Object> data) throws IOException {
        return validator.createValidated(name, data);
    }

    public Map<String, Object> get(String id) throws IOException {
        return engine.get(name, id);
    }

    public List<Map<String, Object>> getAll() throws IOException {
        return engine.getAll(name);
    }

    public QueryResult query(QueryOptions options) throws IOException {
        return engine.query(name, options);
    }

    public Map<String, Object> update(String id, Map<String, Object> patch) throws IOException {
        return engine.update(name, id, patch);
    }

    public Map<String, Object> updateValidated(String id, Map<String, Object> patch) throws IOException {
        return validator.updateValidated(name, id, patch);
    }

    public boolean delete(String id) throws IOException {
        return engine.delete(name, id);
    }

    public boolean deleteValidated(String id) throws IOException {
        return validator.deleteValidated(name, id);
    }

    public int count() throws IOException {
        return engine.count(name);
    }

    public int count(Predicate<Map<String, Object>> where) throws IOException {
        return engine.count(name, where);
    }

    public List<AggregateResult> aggregate(String groupBy, AggregateSpec spec) throws IOException {
        return engine.aggregate(name, groupBy, spec);
    }

    public Subscription subscribe(CollectionListener listener) {
        return engine.subscribe(name, listener);
    }
}
