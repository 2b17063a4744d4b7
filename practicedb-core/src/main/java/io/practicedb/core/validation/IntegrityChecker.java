package io.practicedb.core.validation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.Documents;
import io.practicedb.core.PracticeCollections;

/**
 * Read-only audit: reports orphaned references and duplicate unique tuples without changing anything.
 */
public class IntegrityChecker {

    static final List<String> AUDITED_COLLECTIONS = List.of(PracticeCollections.PATIENTS,
            PracticeCollections.APPOINTMENTS, PracticeCollections.CLAIMS, PracticeCollections.MEDICAL_RECORDS,
            PracticeCollections.LAB_RESULTS, PracticeCollections.TELEMEDICINE_SESSIONS);

    private final DatabaseEngine engine;
    private final IntegrityRules rules;

    public IntegrityChecker(DatabaseEngine engine, IntegrityRules rules) {
        this.engine = engine;
        this.rules = rules;
    }

    public IntegrityReport runIntegrityCheck(String collection) throws IOException {
        List<Map<String, Object>> documents = engine.getAll(collection);
        List<IntegrityIssue> issues = new ArrayList<>();

        for (ReferenceConstraint reference : rules.referencesFrom(collection)) {
            Set<String> targetIds = new HashSet<>();
            for (Map<String, Object> target : engine.getAll(reference.targetCollection())) {
                targetIds.add(Documents.idOf(target));
            }
            for (Map<String, Object> document : documents) {
                Object value = document.get(reference.sourceField());
                if (value != null && !targetIds.contains(String.valueOf(value))) {
                    issues.add(new IntegrityIssue(Documents.idOf(document), IntegrityIssue.Type.ORPHAN,
                            reference.sourceField(), "Referenced " + reference.targetCollection() + " document "
                                    + value + " not found"));
                }
            }
        }

        for (UniqueConstraint constraint : rules.uniqueConstraintsFor(collection)) {
            Map<List<String>, String> firstSeen = new LinkedHashMap<>();
            for (Map<String, Object> document : documents) {
                List<String> tuple = tupleOf(constraint, document);
                if (tuple == null) {
                    continue;
                }
                String first = firstSeen.putIfAbsent(tuple, Documents.idOf(document));
                if (first != null) {
                    issues.add(new IntegrityIssue(Documents.idOf(document), IntegrityIssue.Type.UNIQUE_VIOLATION,
                            String.join(",", constraint.fields()), constraint.describe() + "; duplicates " + first));
                }
            }
        }
        return new IntegrityReport(collection, documents.size(), issues);
    }

    public List<IntegrityReport> runFullIntegrityCheck() throws IOException {
        List<IntegrityReport> reports = new ArrayList<>();
        for (String collection : AUDITED_COLLECTIONS) {
            reports.add(runIntegrityCheck(collection));
        }
        return reports;
    }

    private static List<String> tupleOf(UniqueConstraint constraint, Map<String, Object> document) {
        List<String> tuple = new ArrayList<>();
        for (String field : constraint.fields()) {
            Object value = document.get(field);
            if (value == null) {
                return null;
            }
            tuple.add(String.valueOf(value));
        }
        return tuple;
    }
}
