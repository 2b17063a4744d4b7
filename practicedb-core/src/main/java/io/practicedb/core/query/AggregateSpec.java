package io.practicedb.core.query;

/**
 * Which aggregates to compute per group. Unset fields are skipped.
 */
public class AggregateSpec {
    private boolean count;
    private String sum;
    private String avg;
    private String min;
    private String max;

    public static AggregateSpec create() {
        return new AggregateSpec();
    }

    public AggregateSpec count() {
        this.count = true;
        return this;
    }

    public AggregateSpec sum(String field) {
        this.sum = field;
        return this;
    }

    public AggregateSpec avg(String field) {
        this.avg = field;
        return this;
    }

    public AggregateSpec min(String field) {
        this.min = field;
        return this;
    }

    public AggregateSpec max(String field) {
        this.max = field;
        return this;
    }

    public boolean isCount() {
        return count;
    }

    public String getSum() {
        return sum;
    }

    public String getAvg() {
        return avg;
    }

    public String getMin() {
        return min;
    }

    public String getMax() {
        return max;
    }
}
