package com.bsl.querydsl.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.bsl.querydsl.client.SearchClient;
import com.bsl.querydsl.common.QueryConfigurationException;
import com.bsl.querydsl.connection.ConnectionResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MultiQueryBuilderTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SearchClient client;

    @Captor
    private ArgumentCaptor<List<Map<String, Object>>> bodyCaptor;

    @Test
    void addsQueryFromCallback() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("posts_query", q -> q.index("posts").match("title", "Laravel"));

        List<Map<String, Object>> body = builder.build();

        assertThat(body).hasSize(2);
        assertThat(body.get(0)).isEqualTo(Map.of("index", "posts"));
        assertThat(body.get(1)).isEqualTo(Map.of(
            "query", Map.of("match", Map.of("title", Map.of("query", "Laravel")))
        ));
    }

    @Test
    void addsExistingBuilderByReference() {
        SearchQueryBuilder query = new SearchQueryBuilder().index("posts").match("title", "Laravel");
        MultiQueryBuilder builder = new MultiQueryBuilder().add("posts_query", query);

        query.size(5);

        List<Map<String, Object>> body = builder.build();
        assertThat(body.get(0)).isEqualTo(Map.of("index", "posts"));
        assertThat(body.get(1)).containsEntry("size", 5);
    }

    @Test
    void entriesAreEmittedInNameOrder() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("c_comments", q -> q.index("comments").exists("body"))
            .add("a_posts", q -> q.index("posts").match("title", "Laravel"))
            .add("b_users", q -> q.index("users").term("status", "active"));

        List<Map<String, Object>> body = builder.build();

        assertThat(body).hasSize(6);
        assertThat(body.get(0)).isEqualTo(Map.of("index", "posts"));
        assertThat(body.get(2)).isEqualTo(Map.of("index", "users"));
        assertThat(body.get(4)).isEqualTo(Map.of("index", "comments"));
        assertThat(builder.getNames()).containsExactly("a_posts", "b_users", "c_comments");
    }

    @Test
    void multipleIndicesAreCommaJoined() {
        List<Map<String, Object>> body = new MultiQueryBuilder()
            .add("multi_index_query", q -> q.index(List.of("posts", "pages")).match("content", "search"))
            .build();

        assertThat(body.get(0)).isEqualTo(Map.of("index", "posts,pages"));
    }

    @Test
    void entryWithoutIndexGetsEmptyHeader() {
        List<Map<String, Object>> body = new MultiQueryBuilder()
            .add("anywhere", q -> q.match("title", "x"))
            .build();

        assertThat(body.get(0)).isEmpty();
    }

    @Test
    void sameNameReplacesEarlierEntry() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("posts", q -> q.index("posts").match("title", "first"))
            .add("posts", q -> q.index("posts").match("title", "second"));

        assertThat(builder.count()).isEqualTo(1);
        assertThat(builder.build().get(1).toString()).contains("second");
    }

    @Test
    void countsQueries() {
        MultiQueryBuilder builder = new MultiQueryBuilder();
        assertThat(builder.count()).isZero();

        builder.add("posts_query", q -> q.index("posts").match("title", "Laravel"));
        assertThat(builder.count()).isEqualTo(1);

        builder.add("users_query", q -> q.index("users").term("status", "active"));
        assertThat(builder.count()).isEqualTo(2);
    }

    @Test
    void toArrayEqualsBuild() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("posts_query", q -> q.index("posts").match("title", "Laravel"));

        assertThat(builder.toArray()).isEqualTo(builder.build());
    }

    @Test
    void bodyCarriesPagingSortAndBool() {
        List<Map<String, Object>> body = new MultiQueryBuilder()
            .add("posts_query", q -> q
                .index("posts")
                .bool(b -> {
                    b.must(m -> m.match("title", "Laravel"));
                    b.filter(f -> f.term("status", "published"));
                })
                .size(10)
                .from(0)
                .sort("created_at", "desc"))
            .build();

        JsonNode query = objectMapper.valueToTree(body.get(1));
        assertThat(query.path("size").asInt()).isEqualTo(10);
        assertThat(query.path("from").asInt()).isZero();
        assertThat(query.path("sort").get(0).path("created_at").path("order").asText()).isEqualTo("desc");
        assertThat(query.path("query").path("bool").has("must")).isTrue();
        assertThat(query.path("query").path("bool").has("filter")).isTrue();
    }

    @Test
    void emptyBatchReturnsEmptyResponsesWithoutCallingBackend() {
        JsonNode result = new MultiQueryBuilder(client).execute();

        assertThat(result.path("responses").isArray()).isTrue();
        assertThat(result.path("responses").size()).isZero();
        verifyNoInteractions(client);
    }

    @Test
    void executeWithoutClientFails() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("posts_query", q -> q.index("posts").match("title", "Laravel"));

        assertThatThrownBy(builder::execute)
            .isInstanceOf(QueryConfigurationException.class)
            .hasMessageContaining("Client not set");
    }

    @Test
    void executeSendsBatchAndMapsResponsesByName() throws Exception {
        when(client.msearch(anyList())).thenReturn(objectMapper.readTree(
            "{\"took\":4,\"responses\":["
                + "{\"hits\":{\"total\":{\"value\":5},\"hits\":[{\"_id\":\"1\"}]}},"
                + "{\"hits\":{\"total\":{\"value\":10},\"hits\":[{\"_id\":\"2\"}]}}"
                + "]}"
        ));

        JsonNode result = new MultiQueryBuilder(client)
            .add("b_users", q -> q.index("users").term("status", "active"))
            .add("a_posts", q -> q.index("posts").match("title", "Laravel"))
            .execute();

        verify(client).msearch(bodyCaptor.capture());
        List<Map<String, Object>> sent = bodyCaptor.getValue();
        assertThat(sent).hasSize(4);
        assertThat(sent.get(0)).isEqualTo(Map.of("index", "posts"));
        assertThat(sent.get(1)).containsKey("query");
        assertThat(sent.get(2)).isEqualTo(Map.of("index", "users"));
        assertThat(sent.get(3)).containsKey("query");

        JsonNode responses = result.path("responses");
        assertThat(responses.isObject()).isTrue();
        assertThat(responses.size()).isEqualTo(2);
        assertThat(responses.path("a_posts").path("hits").path("total").path("value").asInt()).isEqualTo(5);
        assertThat(responses.path("b_users").path("hits").path("total").path("value").asInt()).isEqualTo(10);
        assertThat(result.path("took").asInt()).isEqualTo(4);
    }

    @Test
    void missingResponsePositionMapsToNull() throws Exception {
        when(client.msearch(anyList())).thenReturn(objectMapper.readTree(
            "{\"responses\":[{\"hits\":{\"hits\":[]}}]}"
        ));

        JsonNode result = new MultiQueryBuilder(client)
            .add("a", q -> q.index("posts"))
            .add("b", q -> q.index("users"))
            .execute();

        assertThat(result.path("responses").has("b")).isTrue();
        assertThat(result.path("responses").get("b").isNull()).isTrue();
    }

    @Test
    void indexNamesAreUnique() {
        MultiQueryBuilder builder = new MultiQueryBuilder()
            .add("products_query_1", q -> q.index("products").match("name", "test"))
            .add("products_query_2", q -> q.index("products").match("name", "another"))
            .add("categories_query", q -> q.index("categories").match("title", "electronics"));

        assertThat(builder.getIndexNames()).containsExactly("categories", "products");
    }

    @Test
    void cloneWithConnectionKeepsEntries() {
        SearchClient other = mock(SearchClient.class);
        ConnectionResolver resolver = name -> other;
        MultiQueryBuilder builder = new MultiQueryBuilder(QueryContext.of(client).withConnections(resolver))
            .add("posts", q -> q.index("posts"));

        MultiQueryBuilder cloned = builder.cloneWithConnection("secondary");
        MultiQueryBuilder reset = builder.connection("secondary");

        assertThat(cloned.count()).isEqualTo(1);
        assertThat(cloned.getContext().getClient()).isSameAs(other);
        assertThat(reset.count()).isZero();
        assertThat(reset.getContext().getClient()).isSameAs(other);
    }
}
