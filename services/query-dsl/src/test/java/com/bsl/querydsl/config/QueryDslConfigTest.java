package com.bsl.querydsl.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.bsl.querydsl.builder.MultiQueryBuilder;
import com.bsl.querydsl.builder.SearchQueryBuilder;
import com.bsl.querydsl.cache.CacheTtl;
import com.bsl.querydsl.cache.QueryCacheManager;
import com.bsl.querydsl.client.RestSearchClient;
import com.bsl.querydsl.connection.SearchConnectionManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.annotation.UserConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class QueryDslConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(UserConfigurations.of(QueryDslConfig.class))
        .withPropertyValues(
            "querydsl.connections.default.base-url=http://primary:9200",
            "querydsl.connections.reporting.base-url=http://reporting:9200"
        );

    @Test
    void registersFactoryManagersAndBindsProperties() {
        contextRunner
            .withPropertyValues("querydsl.query.max-size=500", "querydsl.logging.log-queries=true")
            .run(context -> {
                assertThat(context).hasSingleBean(SearchQueryFactory.class);
                assertThat(context).hasSingleBean(SearchConnectionManager.class);
                assertThat(context).hasSingleBean(QueryCacheManager.class);

                QueryDslProperties properties = context.getBean(QueryDslProperties.class);
                assertThat(properties.getQuery().getMaxSize()).isEqualTo(500);
                assertThat(properties.getLogging().isLogQueries()).isTrue();
                assertThat(properties.getConnections()).containsOnlyKeys("default", "reporting");
            });
    }

    @Test
    void factoryBindsBuildersToNamedConnections() {
        contextRunner
            .withPropertyValues("querydsl.query.max-size=500")
            .run(context -> {
                SearchQueryFactory factory = context.getBean(SearchQueryFactory.class);

                SearchQueryBuilder query = factory.query();
                MultiQueryBuilder multi = factory.multi("reporting");

                assertThat(((RestSearchClient) query.getContext().getClient()).getConnectionName()).isEqualTo("default");
                assertThat(((RestSearchClient) multi.getContext().getClient()).getConnectionName()).isEqualTo("reporting");
                assertThat(query.getContext().getMaxSize()).isEqualTo(500);
                assertThat(((RestSearchClient) query.connection("reporting").getContext().getClient()).getConnectionName())
                    .isEqualTo("reporting");
            });
    }

    @Test
    void cacheDefaultsComeFromProperties() {
        contextRunner
            .withPropertyValues(
                "querydsl.cache.enabled=true",
                "querydsl.cache.fresh-ttl-seconds=120",
                "querydsl.cache.stale-ttl-seconds=240",
                "querydsl.cache.prefix=es:"
            )
            .run(context -> {
                QueryCacheManager cacheManager = context.getBean(QueryCacheManager.class);
                assertThat(cacheManager.getStoreNames()).containsExactly("memory");
                assertThat(cacheManager.getDefaults().getTtl()).isEqualTo(CacheTtl.flexibleSeconds(120, 240));

                SearchQueryBuilder query = context.getBean(SearchQueryFactory.class).query();
                assertThat(query.isCacheEnabled()).isTrue();
                assertThat(query.getCachePrefix()).isEqualTo("es:");
                assertThat(query.getCacheStore()).isEqualTo("memory");
            });
    }

    @Test
    void equalFreshAndStaleTtlGivesSingleTtl() {
        contextRunner
            .withPropertyValues("querydsl.cache.fresh-ttl-seconds=60", "querydsl.cache.stale-ttl-seconds=60")
            .run(context -> assertThat(context.getBean(QueryCacheManager.class).getDefaults().getTtl())
                .isEqualTo(CacheTtl.ofSeconds(60)));
    }
}
