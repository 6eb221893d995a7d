package com.bsl.querydsl.connection;

import com.bsl.querydsl.client.RestSearchClient;
import com.bsl.querydsl.client.SearchClient;
import com.bsl.querydsl.common.QueryConfigurationException;
import com.bsl.querydsl.config.QueryDslProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

public class SearchConnectionManager implements ConnectionResolver {
    private static final Logger log = LoggerFactory.getLogger(SearchConnectionManager.class);

    private final QueryDslProperties properties;
    private final RestTemplateBuilder restTemplateBuilder;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<String, SearchClient> clients = new ConcurrentHashMap<>();

    public SearchConnectionManager(
        QueryDslProperties properties,
        RestTemplateBuilder restTemplateBuilder,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.restTemplateBuilder = restTemplateBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public SearchClient resolve(String name) {
        String resolved = name == null || name.isBlank() ? getDefaultConnection() : name;
        return clients.computeIfAbsent(resolved, this::makeConnection);
    }

    public String getDefaultConnection() {
        return properties.getDefaultConnection();
    }

    public List<String> getConnections() {
        return List.copyOf(properties.getConnections().keySet());
    }

    public void purge(String name) {
        clients.remove(name);
    }

    public void disconnect() {
        clients.clear();
    }

    private SearchClient makeConnection(String name) {
        QueryDslProperties.Connection connection = properties.getConnections().get(name);
        if (connection == null) {
            throw new QueryConfigurationException("Search connection [" + name + "] not configured.");
        }
        RestTemplate restTemplate = restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(connection.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(connection.getReadTimeoutMs()))
            .build();
        log.info("search connection created name={} base_url={}", name, connection.getBaseUrl());
        return new RestSearchClient(name, restTemplate, objectMapper, connection, properties.getLogging());
    }
}
