package com.bsl.querydsl.config;

import com.bsl.querydsl.builder.MultiQueryBuilder;
import com.bsl.querydsl.builder.QueryContext;
import com.bsl.querydsl.builder.SearchQueryBuilder;
import com.bsl.querydsl.connection.ConnectionResolver;

/**
 * Entry point for application code: hands out builders bound to a configured connection
 * and to the shared cache manager.
 */
public class SearchQueryFactory {
    private final QueryContext baseContext;
    private final ConnectionResolver connections;

    public SearchQueryFactory(QueryContext baseContext) {
        this.baseContext = baseContext;
        this.connections = baseContext.getConnections();
    }

    public SearchQueryBuilder query() {
        return query(null);
    }

    public SearchQueryBuilder query(String connection) {
        return new SearchQueryBuilder(contextFor(connection));
    }

    public MultiQueryBuilder multi() {
        return multi(null);
    }

    public MultiQueryBuilder multi(String connection) {
        return new MultiQueryBuilder(contextFor(connection));
    }

    private QueryContext contextFor(String connection) {
        return baseContext.withClient(connections.resolve(connection));
    }
}
