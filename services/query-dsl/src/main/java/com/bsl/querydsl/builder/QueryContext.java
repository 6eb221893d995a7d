package com.bsl.querydsl.builder;

import com.bsl.querydsl.cache.QueryCacheDefaults;
import com.bsl.querydsl.cache.QueryCacheManager;
import com.bsl.querydsl.client.SearchClient;
import com.bsl.querydsl.common.QueryConfigurationException;
import com.bsl.querydsl.connection.ConnectionResolver;

/**
 * Collaborators and settings a builder is created with. Every field is optional; a builder
 * without a client can still build bodies and derive cache keys.
 */
public final class QueryContext {
    public static final int DEFAULT_MAX_SIZE = 10000;

    private final SearchClient client;
    private final ConnectionResolver connections;
    private final QueryCacheManager cacheManager;
    private final int maxSize;

    public QueryContext(SearchClient client, ConnectionResolver connections, QueryCacheManager cacheManager, int maxSize) {
        this.client = client;
        this.connections = connections;
        this.cacheManager = cacheManager;
        this.maxSize = maxSize <= 0 ? DEFAULT_MAX_SIZE : maxSize;
    }

    public static QueryContext empty() {
        return new QueryContext(null, null, null, DEFAULT_MAX_SIZE);
    }

    public static QueryContext of(SearchClient client) {
        return new QueryContext(client, null, null, DEFAULT_MAX_SIZE);
    }

    public QueryContext withClient(SearchClient client) {
        return new QueryContext(client, connections, cacheManager, maxSize);
    }

    public QueryContext withConnections(ConnectionResolver connections) {
        return new QueryContext(client, connections, cacheManager, maxSize);
    }

    public QueryContext withCacheManager(QueryCacheManager cacheManager) {
        return new QueryContext(client, connections, cacheManager, maxSize);
    }

    public SearchClient getClient() {
        return client;
    }

    public ConnectionResolver getConnections() {
        return connections;
    }

    public QueryCacheManager getCacheManager() {
        return cacheManager;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public QueryCacheDefaults getCacheDefaults() {
        return cacheManager == null ? QueryCacheDefaults.none() : cacheManager.getDefaults();
    }

    SearchClient requireClient() {
        if (client == null) {
            throw new QueryConfigurationException("Client not set. Cannot execute query.");
        }
        return client;
    }

    SearchClient resolveConnection(String name) {
        if (connections == null) {
            throw new QueryConfigurationException("Connection resolver not available. Cannot switch connections.");
        }
        return connections.resolve(name);
    }

    QueryCacheManager requireCacheManager() {
        if (cacheManager == null) {
            throw new QueryConfigurationException("Query cache manager not available. Cannot cache query results.");
        }
        return cacheManager;
    }
}
