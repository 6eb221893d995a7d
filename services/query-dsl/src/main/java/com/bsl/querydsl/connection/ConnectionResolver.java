package com.bsl.querydsl.connection;

import com.bsl.querydsl.client.SearchClient;

public interface ConnectionResolver {

    /**
     * Returns the client for a configured connection. A {@code null} or blank name resolves
     * the default connection.
     *
     * @throws com.bsl.querydsl.common.QueryConfigurationException if the name is not configured
     */
    SearchClient resolve(String name);
}
