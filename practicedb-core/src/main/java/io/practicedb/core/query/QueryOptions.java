package io.practicedb.core.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Filter, ordering, pagination and projection for {@code DatabaseEngine.query}.
 * <p>
 * Pagination is applied after filtering and sorting; projection is applied last. Only one of
 * {@code include} and {@code exclude} may be set.
 */
public class QueryOptions {
    public static final int DEFAULT_LIMIT = 50;

    public enum Direction {
        ASC, DESC
    }

    private Predicate<Map<String, Object>> where;
    private String orderBy;
    private Direction orderDirection = Direction.ASC;
    private int limit = DEFAULT_LIMIT;
    private int offset = 0;
    private List<String> include = Collections.emptyList();
    private List<String> exclude = Collections.emptyList();

    public static QueryOptions all() {
        return new QueryOptions();
    }

    public QueryOptions where(Predicate<Map<String, Object>> predicate) {
        this.where = predicate;
        return this;
    }

    public QueryOptions where(Map<String, ?> equalities) {
        this.where = Where.matching(equalities);
        return this;
    }

    public QueryOptions orderBy(String field) {
        return orderBy(field, Direction.ASC);
    }

    public QueryOptions orderBy(String field, Direction direction) {
        this.orderBy = field;
        this.orderDirection = direction;
        return this;
    }

    public QueryOptions limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        return this;
    }

    public QueryOptions offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        this.offset = offset;
        return this;
    }

    public QueryOptions include(String... fields) {
        if (!exclude.isEmpty()) {
            throw new IllegalArgumentException("include and exclude are mutually exclusive");
        }
        this.include = new ArrayList<>(Arrays.asList(fields));
        return this;
    }

    public QueryOptions exclude(String... fields) {
        if (!include.isEmpty()) {
            throw new IllegalArgumentException("include and exclude are mutually exclusive");
        }
        this.exclude = new ArrayList<>(Arrays.asList(fields));
        return this;
    }

    public Predicate<Map<String, Object>> getWhere() {
        return where;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public Direction getOrderDirection() {
        return orderDirection;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public List<String> getInclude() {
        return include;
    }

    public List<String> getExclude() {
        return exclude;
    }
}
