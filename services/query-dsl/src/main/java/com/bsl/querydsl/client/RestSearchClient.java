package com.bsl.querydsl.client;

import com.bsl.querydsl.config.QueryDslProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

public class RestSearchClient implements SearchClient {
    private static final Logger log = LoggerFactory.getLogger(RestSearchClient.class);
    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final String connectionName;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final QueryDslProperties.Connection connection;
    private final QueryDslProperties.Logging logging;

    public RestSearchClient(
        String connectionName,
        RestTemplate restTemplate,
        ObjectMapper objectMapper,
        QueryDslProperties.Connection connection,
        QueryDslProperties.Logging logging
    ) {
        this.connectionName = connectionName;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.connection = connection;
        this.logging = logging == null ? new QueryDslProperties.Logging() : logging;
    }

    @Override
    public JsonNode search(SearchParams params) {
        String path = params.hasIndex()
            ? "/" + String.join(",", params.getIndex()) + "/_search"
            : "/_search";
        try {
            String payload = params.hasBody() ? objectMapper.writeValueAsString(params.getBody()) : "{}";
            return post(path, payload, MediaType.APPLICATION_JSON);
        } catch (JsonProcessingException e) {
            throw new SearchBackendRequestException("Failed to serialize search body", e);
        }
    }

    @Override
    public JsonNode msearch(List<Map<String, Object>> body) {
        StringBuilder payload = new StringBuilder();
        try {
            for (Map<String, Object> line : body) {
                payload.append(objectMapper.writeValueAsString(line)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new SearchBackendRequestException("Failed to serialize msearch body", e);
        }
        return post("/_msearch", payload.toString(), NDJSON);
    }

    public String getConnectionName() {
        return connectionName;
    }

    private JsonNode post(String path, String payload, MediaType contentType) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(contentType);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        applyAuthentication(headers);
        if (logging.isLogQueries()) {
            log.debug("search request connection={} path={} body={}", connectionName, path, payload);
        }
        long started = System.nanoTime();
        try {
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            return objectMapper.readTree(response.getBody());
        } catch (ResourceAccessException e) {
            throw new SearchBackendUnavailableException("Search backend unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new SearchBackendUnavailableException("Search backend unavailable: " + status, e);
            }
            throw new SearchBackendRequestException("Search backend error: " + status, status, e);
        } catch (JsonProcessingException e) {
            throw new SearchBackendRequestException("Failed to parse search response", e);
        } finally {
            long tookMs = (System.nanoTime() - started) / 1_000_000L;
            if (logging.getSlowQueryThresholdMs() > 0 && tookMs >= logging.getSlowQueryThresholdMs()) {
                log.warn("slow search request connection={} path={} took_ms={}", connectionName, path, tookMs);
            }
        }
    }

    private void applyAuthentication(HttpHeaders headers) {
        if (connection == null) {
            return;
        }
        if (!isBlank(connection.getApiKey())) {
            headers.set(HttpHeaders.AUTHORIZATION, "ApiKey " + connection.getApiKey());
        } else if (!isBlank(connection.getUsername()) && !isBlank(connection.getPassword())) {
            headers.setBasicAuth(connection.getUsername(), connection.getPassword());
        }
    }

    private String buildUrl(String path) {
        String base = connection == null || connection.getBaseUrl() == null ? "" : connection.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
