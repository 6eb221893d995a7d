package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * A query's request body and index names captured at one point in time, together with a
 * runner that sends exactly that request. Later changes to the originating builder do not
 * affect it, so a background refresh stores the result the cache key was derived from.
 */
public final class QuerySnapshot implements ExecutableQuery {
    private final Object body;
    private final SortedSet<String> indexNames;
    private final Supplier<JsonNode> runner;

    public QuerySnapshot(Object body, SortedSet<String> indexNames, Supplier<JsonNode> runner) {
        this.body = body;
        this.indexNames = Collections.unmodifiableSortedSet(
            indexNames == null ? new TreeSet<>() : new TreeSet<>(indexNames)
        );
        this.runner = runner;
    }

    public Object getBody() {
        return body;
    }

    public SortedSet<String> getIndexNames() {
        return indexNames;
    }

    @Override
    public JsonNode execute() {
        return runner.get();
    }
}
