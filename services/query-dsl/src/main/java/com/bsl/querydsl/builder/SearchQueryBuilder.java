package com.bsl.querydsl.builder;

import com.bsl.querydsl.cache.QuerySnapshot;
import com.bsl.querydsl.client.SearchClient;
import com.bsl.querydsl.client.SearchParams;
import com.bsl.querydsl.pagination.SearchPage;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Accumulates clauses, filters, sorting, paging, source filtering, highlighting and
 * aggregations, and assembles them into one search request body.
 *
 * <p>Instances are owned by a single caller and are not thread-safe. Every method except
 * {@link #build()}, {@link #execute()} and the sub-builder factories returns this builder.
 */
public class SearchQueryBuilder extends AbstractCacheableBuilder<SearchQueryBuilder> {
    private final List<Map<String, Object>> queries = new ArrayList<>();
    private final List<Map<String, Object>> filters = new ArrayList<>();
    private final Map<String, Object> aggregations = new LinkedHashMap<>();
    private final List<Map<String, Object>> sort = new ArrayList<>();
    private Object source;
    private Map<String, Object> highlight = new LinkedHashMap<>();
    private List<String> index;
    private Integer size;
    private Integer from;

    public SearchQueryBuilder() {
        this(QueryContext.empty());
    }

    public SearchQueryBuilder(SearchClient client) {
        this(QueryContext.of(client));
    }

    public SearchQueryBuilder(QueryContext context) {
        super(context);
    }

    @Override
    protected SearchQueryBuilder self() {
        return this;
    }

    public SearchQueryBuilder index(String index) {
        requireName(index, "index");
        this.index = List.of(index);
        return this;
    }

    public SearchQueryBuilder index(Collection<String> indices) {
        if (indices == null || indices.isEmpty()) {
            throw new IllegalArgumentException("indices must not be empty");
        }
        indices.forEach(name -> requireName(name, "index"));
        this.index = List.copyOf(indices);
        return this;
    }

    public List<String> getIndex() {
        return index;
    }

    /**
     * Returns a new, empty builder bound to the named connection. Accumulated state is not
     * carried over; use {@link #cloneWithConnection(String)} to keep it.
     */
    public SearchQueryBuilder connection(String name) {
        return withConnection(name);
    }

    public SearchQueryBuilder withConnection(String name) {
        return new SearchQueryBuilder(context.withClient(context.resolveConnection(name)));
    }

    public SearchQueryBuilder cloneWithConnection(String name) {
        SearchQueryBuilder copy = new SearchQueryBuilder(context.withClient(context.resolveConnection(name)));
        copy.queries.addAll(queries);
        copy.filters.addAll(filters);
        copy.aggregations.putAll(aggregations);
        copy.sort.addAll(sort);
        copy.source = source;
        copy.highlight = new LinkedHashMap<>(highlight);
        copy.index = index;
        copy.size = size;
        copy.from = from;
        copy.cacheDescriptor = cacheDescriptor.copy();
        return copy;
    }

    public SearchQueryBuilder match(String field, Object value) {
        return match(field, value, Map.of());
    }

    public SearchQueryBuilder match(String field, Object value, Map<String, Object> options) {
        addQuery(clause("match", field, withOptions("query", value, options)));
        return this;
    }

    public SearchQueryBuilder matchPhrase(String field, Object value) {
        return matchPhrase(field, value, Map.of());
    }

    public SearchQueryBuilder matchPhrase(String field, Object value, Map<String, Object> options) {
        addQuery(clause("match_phrase", field, withOptions("query", value, options)));
        return this;
    }

    public SearchQueryBuilder term(String field, Object value) {
        addQuery(clause("term", field, value));
        return this;
    }

    public SearchQueryBuilder terms(String field, Collection<?> values) {
        addQuery(clause("terms", field, List.copyOf(values)));
        return this;
    }

    public SearchQueryBuilder wildcard(String field, String pattern) {
        addQuery(clause("wildcard", field, pattern));
        return this;
    }

    public SearchQueryBuilder fuzzy(String field, Object value) {
        return fuzzy(field, value, Map.of());
    }

    public SearchQueryBuilder fuzzy(String field, Object value, Map<String, Object> options) {
        addQuery(clause("fuzzy", field, withOptions("value", value, options)));
        return this;
    }

    public SearchQueryBuilder exists(String field) {
        requireName(field, "field");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", field);
        addQuery(single("exists", body));
        return this;
    }

    /**
     * Starts a range clause for {@code field}. Nothing is added until a comparator is set.
     * If this builder already holds a range clause for the field, every comparator set on
     * the returned sub-builder is merged into that clause where it stands.
     */
    public RangeQueryBuilder range(String field) {
        requireName(field, "field");
        return new RangeQueryBuilder(this, field);
    }

    public BoolQueryBuilder bool() {
        return new BoolQueryBuilder(context);
    }

    public SearchQueryBuilder bool(Consumer<BoolQueryBuilder> callback) {
        BoolQueryBuilder boolBuilder = new BoolQueryBuilder(context);
        callback.accept(boolBuilder);
        addQuery(boolBuilder.build());
        return this;
    }

    public SearchQueryBuilder nested(String path, Consumer<SearchQueryBuilder> callback) {
        requireName(path, "path");
        Map<String, Object> query = queryOf(context, callback);
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("path", path);
        nested.put("query", query == null ? single("match_all", new LinkedHashMap<>()) : query);
        addQuery(single("nested", nested));
        return this;
    }

    public SearchQueryBuilder filter(Consumer<SearchQueryBuilder> callback) {
        Map<String, Object> query = queryOf(context, callback);
        if (query != null) {
            filters.add(query);
        }
        return this;
    }

    public SearchQueryBuilder size(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        if (size > context.getMaxSize()) {
            throw new IllegalArgumentException("size must be <= " + context.getMaxSize());
        }
        this.size = size;
        return this;
    }

    public SearchQueryBuilder from(int from) {
        if (from < 0) {
            throw new IllegalArgumentException("from must be >= 0");
        }
        this.from = from;
        return this;
    }

    public SearchQueryBuilder sort(String field) {
        return sort(field, "asc");
    }

    public SearchQueryBuilder sort(String field, String direction) {
        requireName(field, "field");
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("order", direction);
        sort.add(single(field, order));
        return this;
    }

    public SearchQueryBuilder sort(Map<String, Object> sortClause) {
        sort.add(copyMap(sortClause));
        return this;
    }

    public SearchQueryBuilder source(List<String> fields) {
        this.source = List.copyOf(fields);
        return this;
    }

    public SearchQueryBuilder source(String field) {
        this.source = field;
        return this;
    }

    public SearchQueryBuilder source(boolean enabled) {
        this.source = enabled;
        return this;
    }

    public SearchQueryBuilder source(Map<String, Object> includeExclude) {
        this.source = copyMap(includeExclude);
        return this;
    }

    public SearchQueryBuilder highlight(Map<String, Object> fields) {
        return highlight(fields, Map.of());
    }

    public SearchQueryBuilder highlight(Map<String, Object> fields, Map<String, Object> options) {
        Map<String, Object> settings = copyMap(options);
        settings.put("fields", copyMap(fields));
        this.highlight = settings;
        return this;
    }

    public SearchQueryBuilder aggregation(String name, Consumer<AggregationBuilder> callback) {
        requireName(name, "aggregation name");
        AggregationBuilder aggregationBuilder = new AggregationBuilder();
        callback.accept(aggregationBuilder);
        aggregations.put(name, aggregationBuilder.build());
        return this;
    }

    public void addQuery(Map<String, Object> query) {
        queries.add(copyMap(query));
    }

    /**
     * Replaces the last clause holding a range on {@code field}. Does nothing when there is
     * no such clause.
     */
    public void updateLastRangeQuery(String field, Map<String, Object> rangeQuery) {
        for (int i = queries.size() - 1; i >= 0; i--) {
            if (rangeBody(queries.get(i), field) != null) {
                queries.set(i, copyMap(rangeQuery));
                return;
            }
        }
    }

    /**
     * Assembles the request body. Absent parts are omitted, never written as null. The
     * returned structure is a fresh copy; mutating it does not affect this builder.
     */
    @Override
    public Map<String, Object> build() {
        Map<String, Object> body = new LinkedHashMap<>();
        Map<String, Object> query = buildQuery();
        if (query != null) {
            body.put("query", query);
        }
        if (size != null) {
            body.put("size", size);
        }
        if (from != null) {
            body.put("from", from);
        }
        if (!sort.isEmpty()) {
            body.put("sort", new ArrayList<>(sort));
        }
        if (source != null) {
            body.put("_source", source);
        }
        if (!highlight.isEmpty()) {
            body.put("highlight", highlight);
        }
        if (!aggregations.isEmpty()) {
            body.put("aggs", aggregations);
        }
        return copyMap(body);
    }

    public Map<String, Object> toArray() {
        return build();
    }

    @Override
    public JsonNode executeUncached() {
        return snapshot().execute();
    }

    @Override
    public QuerySnapshot snapshot() {
        List<String> targetIndex = index;
        Map<String, Object> body = build();
        QueryContext boundContext = context;
        return new QuerySnapshot(body, getIndexNames(), () -> {
            SearchClient client = boundContext.requireClient();
            return client.search(new SearchParams(targetIndex, body));
        });
    }

    public SearchPage paginate(int perPage, int page) {
        if (perPage <= 0) {
            throw new IllegalArgumentException("perPage must be > 0");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        long offset = (long) (page - 1) * perPage;
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("page " + page + " is out of range for perPage " + perPage);
        }
        size(perPage);
        from((int) offset);
        return SearchPage.fromResults(execute(), perPage, page);
    }

    @Override
    public SortedSet<String> getIndexNames() {
        return index == null ? new TreeSet<>() : new TreeSet<>(index);
    }

    Map<String, Object> buildQuery() {
        if (queries.isEmpty() && filters.isEmpty()) {
            return null;
        }
        if (!filters.isEmpty()) {
            Map<String, Object> bool = new LinkedHashMap<>();
            if (!queries.isEmpty()) {
                bool.put("must", queries.size() == 1 ? queries.get(0) : new ArrayList<>(queries));
            }
            bool.put("filter", new ArrayList<>(filters));
            return single("bool", bool);
        }
        if (queries.size() == 1) {
            return queries.get(0);
        }
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", new ArrayList<>(queries));
        return single("bool", bool);
    }

    static Map<String, Object> queryOf(QueryContext context, Consumer<SearchQueryBuilder> callback) {
        SearchQueryBuilder builder = new SearchQueryBuilder(context);
        callback.accept(builder);
        return builder.buildQuery();
    }

    static Map<String, Object> single(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }

    /**
     * Deep copy of a request fragment. Nested maps and lists are copied; scalars are shared.
     */
    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object nested : (Collection<?>) value) {
                copy.add(copyValue(nested));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> copyMap(Map<String, Object> value) {
        return value == null ? new LinkedHashMap<>() : (Map<String, Object>) copyValue(value);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> findLastRange(String field) {
        for (int i = queries.size() - 1; i >= 0; i--) {
            Object body = rangeBody(queries.get(i), field);
            if (body instanceof Map) {
                return (Map<String, Object>) body;
            }
        }
        return null;
    }

    private static Object rangeBody(Map<String, Object> clause, String field) {
        Object range = clause.get("range");
        if (range instanceof Map) {
            return ((Map<?, ?>) range).get(field);
        }
        return null;
    }

    private static Map<String, Object> clause(String type, String field, Object body) {
        requireName(field, "field");
        return single(type, single(field, body));
    }

    private static Map<String, Object> withOptions(String valueKey, Object value, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(valueKey, value);
        if (options != null) {
            body.putAll(options);
        }
        return body;
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
