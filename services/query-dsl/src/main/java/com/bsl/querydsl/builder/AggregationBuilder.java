package com.bsl.querydsl.builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builds one aggregation: a single bucket or metric definition plus optional named
 * sub-aggregations. Setting another kind replaces the previous definition.
 */
public class AggregationBuilder {
    private String kind;
    private Map<String, Object> definition;
    private final Map<String, Object> subAggregations = new LinkedHashMap<>();

    public AggregationBuilder terms(String field) {
        return terms(field, Map.of());
    }

    public AggregationBuilder terms(String field, int size) {
        return terms(field, Map.of("size", size));
    }

    public AggregationBuilder terms(String field, Map<String, Object> options) {
        return define("terms", field, options);
    }

    public AggregationBuilder dateHistogram(String field, String calendarInterval) {
        return dateHistogram(field, calendarInterval, Map.of());
    }

    public AggregationBuilder dateHistogram(String field, String calendarInterval, Map<String, Object> options) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("calendar_interval", calendarInterval);
        merged.putAll(options);
        return define("date_histogram", field, merged);
    }

    public AggregationBuilder range(String field, List<Map<String, Object>> ranges) {
        return range(field, ranges, Map.of());
    }

    public AggregationBuilder range(String field, List<Map<String, Object>> ranges, Map<String, Object> options) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("ranges", List.copyOf(ranges));
        merged.putAll(options);
        return define("range", field, merged);
    }

    public AggregationBuilder histogram(String field, Number interval) {
        return histogram(field, interval, Map.of());
    }

    public AggregationBuilder histogram(String field, Number interval, Map<String, Object> options) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("interval", interval);
        merged.putAll(options);
        return define("histogram", field, merged);
    }

    public AggregationBuilder avg(String field) {
        return avg(field, Map.of());
    }

    public AggregationBuilder avg(String field, Map<String, Object> options) {
        return define("avg", field, options);
    }

    public AggregationBuilder sum(String field) {
        return sum(field, Map.of());
    }

    public AggregationBuilder sum(String field, Map<String, Object> options) {
        return define("sum", field, options);
    }

    public AggregationBuilder min(String field) {
        return min(field, Map.of());
    }

    public AggregationBuilder min(String field, Map<String, Object> options) {
        return define("min", field, options);
    }

    public AggregationBuilder max(String field) {
        return max(field, Map.of());
    }

    public AggregationBuilder max(String field, Map<String, Object> options) {
        return define("max", field, options);
    }

    public AggregationBuilder count(String field) {
        return count(field, Map.of());
    }

    public AggregationBuilder count(String field, Map<String, Object> options) {
        return define("value_count", field, options);
    }

    public AggregationBuilder cardinality(String field) {
        return cardinality(field, Map.of());
    }

    public AggregationBuilder cardinality(String field, Map<String, Object> options) {
        return define("cardinality", field, options);
    }

    public AggregationBuilder subAggregation(String name, Consumer<AggregationBuilder> callback) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("aggregation name must not be blank");
        }
        AggregationBuilder child = new AggregationBuilder();
        callback.accept(child);
        subAggregations.put(name, child.build());
        return this;
    }

    public Map<String, Object> build() {
        Map<String, Object> aggregation = new LinkedHashMap<>();
        if (kind != null) {
            aggregation.put(kind, new LinkedHashMap<>(definition));
        }
        if (!subAggregations.isEmpty()) {
            aggregation.put("aggs", new LinkedHashMap<>(subAggregations));
        }
        return aggregation;
    }

    private AggregationBuilder define(String kind, String field, Map<String, Object> options) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", field);
        body.putAll(options);
        this.kind = kind;
        this.definition = body;
        return this;
    }
}
