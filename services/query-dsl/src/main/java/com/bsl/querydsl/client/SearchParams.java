package com.bsl.querydsl.client;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class SearchParams {
    private final List<String> index;
    private final Map<String, Object> body;

    public SearchParams(List<String> index, Map<String, Object> body) {
        this.index = index == null ? null : List.copyOf(index);
        this.body = body == null || body.isEmpty() ? null : Collections.unmodifiableMap(body);
    }

    public List<String> getIndex() {
        return index;
    }

    public Map<String, Object> getBody() {
        return body;
    }

    public boolean hasIndex() {
        return index != null && !index.isEmpty();
    }

    public boolean hasBody() {
        return body != null;
    }
}
