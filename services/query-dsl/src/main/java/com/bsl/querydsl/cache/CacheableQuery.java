package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.SortedSet;

/**
 * A query whose result can be cached: it exposes the request body the key is derived
 * from, the indexes it touches and a way to run it without the cache.
 */
public interface CacheableQuery extends ExecutableQuery {

    Object build();

    SortedSet<String> getIndexNames();

    CacheDescriptor getCacheDescriptor();

    JsonNode executeUncached();

    /**
     * Captures the current request body and index names with a runner bound to them.
     */
    QuerySnapshot snapshot();
}
