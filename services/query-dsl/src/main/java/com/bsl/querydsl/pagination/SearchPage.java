package com.bsl.querydsl.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of hits taken from a raw search response ({@code hits.hits} and
 * {@code hits.total.value}).
 */
public class SearchPage {
    private final List<JsonNode> items;
    private final long total;
    private final int perPage;
    private final int currentPage;
    private final JsonNode response;

    public SearchPage(List<JsonNode> items, long total, int perPage, int currentPage, JsonNode response) {
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
        this.total = Math.max(0L, total);
        this.perPage = Math.max(1, perPage);
        this.currentPage = Math.max(1, currentPage);
        this.response = response;
    }

    public static SearchPage fromResults(JsonNode results, int perPage, int currentPage) {
        List<JsonNode> items = new ArrayList<>();
        long total = 0L;
        if (results != null) {
            for (JsonNode hit : results.path("hits").path("hits")) {
                items.add(hit);
            }
            JsonNode totalNode = results.path("hits").path("total");
            // older clusters report the total as a bare number
            total = totalNode.isNumber() ? totalNode.asLong() : totalNode.path("value").asLong(0L);
        }
        return new SearchPage(items, total, perPage, currentPage, results);
    }

    public List<JsonNode> getItems() {
        return items;
    }

    public long getTotal() {
        return total;
    }

    public int getPerPage() {
        return perPage;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public int getLastPage() {
        return (int) Math.max(1L, (total + perPage - 1) / perPage);
    }

    public boolean hasMorePages() {
        return currentPage < getLastPage();
    }

    public JsonNode getResponse() {
        return response;
    }
}
