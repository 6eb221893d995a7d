package com.bsl.querydsl.builder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public class BoolQueryBuilder {
    private final QueryContext context;
    private final List<Map<String, Object>> must = new ArrayList<>();
    private final List<Map<String, Object>> should = new ArrayList<>();
    private final List<Map<String, Object>> filter = new ArrayList<>();
    private final List<Map<String, Object>> mustNot = new ArrayList<>();
    private Integer minimumShouldMatch;

    BoolQueryBuilder(QueryContext context) {
        this.context = context;
    }

    public BoolQueryBuilder must(Consumer<SearchQueryBuilder> callback) {
        return append(must, List.of(callback));
    }

    public BoolQueryBuilder must(List<Consumer<SearchQueryBuilder>> callbacks) {
        return append(must, callbacks);
    }

    public BoolQueryBuilder should(Consumer<SearchQueryBuilder> callback) {
        return append(should, List.of(callback));
    }

    public BoolQueryBuilder should(List<Consumer<SearchQueryBuilder>> callbacks) {
        return append(should, callbacks);
    }

    public BoolQueryBuilder filter(Consumer<SearchQueryBuilder> callback) {
        return append(filter, List.of(callback));
    }

    public BoolQueryBuilder filter(List<Consumer<SearchQueryBuilder>> callbacks) {
        return append(filter, callbacks);
    }

    public BoolQueryBuilder mustNot(Consumer<SearchQueryBuilder> callback) {
        return append(mustNot, List.of(callback));
    }

    public BoolQueryBuilder mustNot(List<Consumer<SearchQueryBuilder>> callbacks) {
        return append(mustNot, callbacks);
    }

    public BoolQueryBuilder minimumShouldMatch(int minimumShouldMatch) {
        this.minimumShouldMatch = minimumShouldMatch;
        return this;
    }

    /**
     * Emits {@code {bool: {...}}} with the non-empty groups only; a group with one clause is
     * written bare, otherwise as an array.
     */
    public Map<String, Object> build() {
        Map<String, Object> bool = new LinkedHashMap<>();
        putGroup(bool, "must", must);
        putGroup(bool, "should", should);
        putGroup(bool, "filter", filter);
        putGroup(bool, "must_not", mustNot);
        if (minimumShouldMatch != null) {
            bool.put("minimum_should_match", minimumShouldMatch);
        }
        return SearchQueryBuilder.single("bool", bool);
    }

    private BoolQueryBuilder append(List<Map<String, Object>> group, List<Consumer<SearchQueryBuilder>> callbacks) {
        for (Consumer<SearchQueryBuilder> callback : callbacks) {
            Map<String, Object> query = SearchQueryBuilder.queryOf(context, callback);
            if (query != null) {
                group.add(query);
            }
        }
        return this;
    }

    private static void putGroup(Map<String, Object> bool, String key, List<Map<String, Object>> group) {
        if (group.isEmpty()) {
            return;
        }
        bool.put(key, group.size() == 1 ? group.get(0) : new ArrayList<>(group));
    }
}
