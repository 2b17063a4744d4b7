package io.practicedb.core.validation;

import java.util.List;

public record IntegrityReport(String collection, int totalRecords, List<IntegrityIssue> issues) {

    public IntegrityReport {
        issues = List.copyOf(issues);
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
