package com.bsl.querydsl.builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a single field's range clause back into its owning builder on every change.
 * Each change merges into the owner's current clause for the field, so several
 * sub-builders for one field never drop each other's comparators.
 */
public class RangeQueryBuilder {
    private final SearchQueryBuilder owner;
    private final String field;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    RangeQueryBuilder(SearchQueryBuilder owner, String field) {
        this.owner = owner;
        this.field = field;
        Map<String, Object> existing = owner.findLastRange(field);
        if (existing != null) {
            parameters.putAll(existing);
        }
    }

    public RangeQueryBuilder gt(Object value) {
        return set("gt", value);
    }

    public RangeQueryBuilder gte(Object value) {
        return set("gte", value);
    }

    public RangeQueryBuilder lt(Object value) {
        return set("lt", value);
    }

    public RangeQueryBuilder lte(Object value) {
        return set("lte", value);
    }

    public RangeQueryBuilder format(String format) {
        return set("format", format);
    }

    public RangeQueryBuilder timeZone(String timeZone) {
        return set("time_zone", timeZone);
    }

    public String getField() {
        return field;
    }

    public Map<String, Object> build() {
        return SearchQueryBuilder.single("range", SearchQueryBuilder.single(field, new LinkedHashMap<>(parameters)));
    }

    private RangeQueryBuilder set(String key, Object value) {
        Map<String, Object> current = owner.findLastRange(field);
        parameters.clear();
        if (current != null) {
            parameters.putAll(current);
        }
        parameters.put(key, value);
        if (current != null) {
            owner.updateLastRangeQuery(field, build());
        } else {
            owner.addQuery(build());
        }
        return this;
    }
}
