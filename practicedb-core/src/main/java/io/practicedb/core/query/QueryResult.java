package io.practicedb.core.query;

import java.util.List;
import java.util.Map;

/**
 * One page of a query. {@code total} counts every match before pagination.
 */
public record QueryResult(List<Map<String, Object>> data, int total, int page, int pageSize, int totalPages) {
}
