package eu.devmetrics.app.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value produced by a metric. Each metric declares one shape.
 */
public sealed interface MetricValue {

    boolean isEmpty();

    /**
     * Short human readable rendering used in log lines and summaries.
     */
    String describe();

    /**
     * A single number.
     */
    record Scalar(double value) implements MetricValue {
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public String describe() {
            return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
        }
    }

    /**
     * Ordered list of rows.
     */
    record Table<R>(List<R> rows) implements MetricValue {
        public Table {
            rows = List.copyOf(rows);
        }

        @Override
        public boolean isEmpty() {
            return rows.isEmpty();
        }

        @Override
        public String describe() {
            return rows.size() + " rows";
        }
    }

    /**
     * Rows addressed by key, in insertion order.
     */
    record KeyedTable<R>(Map<String, R> entries) implements MetricValue {
        public KeyedTable {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isEmpty() {
            return entries.isEmpty();
        }

        @Override
        public String describe() {
            return entries.size() + " entries";
        }
    }

    /**
     * Counts per bucket, in insertion order.
     */
    record Distribution(Map<String, Integer> buckets) implements MetricValue {
        public Distribution {
            buckets = Collections.unmodifiableMap(new LinkedHashMap<>(buckets));
        }

        @Override
        public boolean isEmpty() {
            return buckets.isEmpty();
        }

        @Override
        public String describe() {
            return buckets.size() + " buckets";
        }
    }

    /**
     * A typed statistics object. {@code stats} is null for empty input.
     */
    record Summary<T>(T stats) implements MetricValue {

        public static <T> Summary<T> empty() {
            return new Summary<>(null);
        }

        @Override
        public boolean isEmpty() {
            return stats == null;
        }

        @Override
        public String describe() {
            return isEmpty() ? "no data" : stats.getClass().getSimpleName();
        }
    }
}
