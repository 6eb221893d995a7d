package com.bsl.querydsl.builder;

import com.bsl.querydsl.cache.QuerySnapshot;
import com.bsl.querydsl.client.SearchClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Named batch of search queries sent as one multi-search request. Entries are always
 * emitted in ascending name order, and the positional responses are mapped back onto the
 * names in that same order.
 */
public class MultiQueryBuilder extends AbstractCacheableBuilder<MultiQueryBuilder> {
    private final TreeMap<String, SearchQueryBuilder> queries = new TreeMap<>();

    public MultiQueryBuilder() {
        this(QueryContext.empty());
    }

    public MultiQueryBuilder(SearchClient client) {
        this(QueryContext.of(client));
    }

    public MultiQueryBuilder(QueryContext context) {
        super(context);
    }

    @Override
    protected MultiQueryBuilder self() {
        return this;
    }

    public MultiQueryBuilder connection(String name) {
        return withConnection(name);
    }

    public MultiQueryBuilder withConnection(String name) {
        return new MultiQueryBuilder(context.withClient(context.resolveConnection(name)));
    }

    public MultiQueryBuilder cloneWithConnection(String name) {
        MultiQueryBuilder copy = new MultiQueryBuilder(context.withClient(context.resolveConnection(name)));
        copy.queries.putAll(queries);
        copy.cacheDescriptor = cacheDescriptor.copy();
        return copy;
    }

    public MultiQueryBuilder add(String name, Consumer<SearchQueryBuilder> callback) {
        SearchQueryBuilder builder = new SearchQueryBuilder(context);
        callback.accept(builder);
        return add(name, builder);
    }

    /**
     * Stores the builder by reference; changes made to it before {@link #build()} are
     * reflected in the batch.
     */
    public MultiQueryBuilder add(String name, SearchQueryBuilder builder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("query name must not be blank");
        }
        queries.put(name, builder);
        return this;
    }

    public int count() {
        return queries.size();
    }

    public List<String> getNames() {
        return new ArrayList<>(queries.keySet());
    }

    @Override
    public List<Map<String, Object>> build() {
        List<Map<String, Object>> body = new ArrayList<>(queries.size() * 2);
        for (SearchQueryBuilder query : queries.values()) {
            Map<String, Object> header = new LinkedHashMap<>();
            List<String> index = query.getIndex();
            if (index != null && !index.isEmpty()) {
                header.put("index", String.join(",", index));
            }
            body.add(header);
            body.add(query.build());
        }
        return body;
    }

    public List<Map<String, Object>> toArray() {
        return build();
    }

    @Override
    public JsonNode executeUncached() {
        return snapshot().execute();
    }

    @Override
    public QuerySnapshot snapshot() {
        List<String> names = getNames();
        List<Map<String, Object>> body = build();
        QueryContext boundContext = context;
        return new QuerySnapshot(body, getIndexNames(), () -> send(boundContext, names, body));
    }

    private static JsonNode send(QueryContext context, List<String> names, List<Map<String, Object>> body) {
        SearchClient client = context.requireClient();
        if (names.isEmpty()) {
            ObjectNode empty = JsonNodeFactory.instance.objectNode();
            empty.putArray("responses");
            return empty;
        }
        JsonNode results = client.msearch(body);
        ObjectNode mapped = results != null && results.isObject()
            ? ((ObjectNode) results).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        JsonNode responses = results == null ? null : results.get("responses");
        ObjectNode named = JsonNodeFactory.instance.objectNode();
        int position = 0;
        for (String name : names) {
            JsonNode response = responses == null ? null : responses.get(position);
            named.set(name, response == null ? NullNode.getInstance() : response);
            position++;
        }
        mapped.set("responses", named);
        return mapped;
    }

    @Override
    public SortedSet<String> getIndexNames() {
        SortedSet<String> names = new TreeSet<>();
        for (SearchQueryBuilder query : queries.values()) {
            names.addAll(query.getIndexNames());
        }
        return names;
    }
}
