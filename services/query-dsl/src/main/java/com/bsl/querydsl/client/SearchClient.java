package com.bsl.querydsl.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Transport-level access to a search cluster. Implementations own connection handling;
 * builders only hand over request bodies and return the raw response.
 */
public interface SearchClient {

    JsonNode search(SearchParams params);

    /**
     * Runs a batched search. {@code body} alternates header and query objects.
     */
    JsonNode msearch(List<Map<String, Object>> body);
}
