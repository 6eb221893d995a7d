package com.bsl.querydsl.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "querydsl")
public class QueryDslProperties {
    private String defaultConnection = "default";
    private Map<String, Connection> connections = new LinkedHashMap<>();
    private Query query = new Query();
    private Logging logging = new Logging();
    private Cache cache = new Cache();

    public String getDefaultConnection() {
        return defaultConnection;
    }

    public void setDefaultConnection(String defaultConnection) {
        this.defaultConnection = defaultConnection;
    }

    public Map<String, Connection> getConnections() {
        return connections;
    }

    public void setConnections(Map<String, Connection> connections) {
        this.connections = connections;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Logging getLogging() {
        return logging;
    }

    public void setLogging(Logging logging) {
        this.logging = logging;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public static class Connection {
        private String baseUrl = "http://localhost:9200";
        private String username;
        private String password;
        private String apiKey;
        private int connectTimeoutMs = 1000;
        private int readTimeoutMs = 10000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class Query {
        private int maxSize = 10000;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class Logging {
        private boolean logQueries = false;
        private long slowQueryThresholdMs = 1000;

        public boolean isLogQueries() {
            return logQueries;
        }

        public void setLogQueries(boolean logQueries) {
            this.logQueries = logQueries;
        }

        public long getSlowQueryThresholdMs() {
            return slowQueryThresholdMs;
        }

        public void setSlowQueryThresholdMs(long slowQueryThresholdMs) {
            this.slowQueryThresholdMs = slowQueryThresholdMs;
        }
    }

    public static class Cache {
        private boolean enabled = false;
        private long freshTtlSeconds = 300;
        private long staleTtlSeconds = 600;
        private String prefix = "querydsl:";
        private String store = "memory";
        private int maxEntries = 1000;
        private int refreshPoolSize = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFreshTtlSeconds() {
            return freshTtlSeconds;
        }

        public void setFreshTtlSeconds(long freshTtlSeconds) {
            this.freshTtlSeconds = freshTtlSeconds;
        }

        public long getStaleTtlSeconds() {
            return staleTtlSeconds;
        }

        public void setStaleTtlSeconds(long staleTtlSeconds) {
            this.staleTtlSeconds = staleTtlSeconds;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public int getRefreshPoolSize() {
            return refreshPoolSize;
        }

        public void setRefreshPoolSize(int refreshPoolSize) {
            this.refreshPoolSize = refreshPoolSize;
        }
    }
}
