package io.practicedb.core.query;

/**
 * Aggregates for one group value. Fields that were not requested are null.
 */
public record AggregateResult(Object group, Integer count, Double sum, Double avg, Object min, Object max) {
}
