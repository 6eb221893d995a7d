package com.bsl.querydsl.config;

import com.bsl.querydsl.builder.QueryContext;
import com.bsl.querydsl.cache.InMemoryResultCacheStore;
import com.bsl.querydsl.cache.QueryCacheDefaults;
import com.bsl.querydsl.cache.QueryCacheManager;
import com.bsl.querydsl.cache.RedisResultCacheStore;
import com.bsl.querydsl.cache.ResultCacheStore;
import com.bsl.querydsl.connection.SearchConnectionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(QueryDslProperties.class)
public class QueryDslConfig {
    private static final Logger log = LoggerFactory.getLogger(QueryDslConfig.class);

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "queryCacheRefreshExecutor")
    public ExecutorService queryCacheRefreshExecutor(QueryDslProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getCache().getRefreshPoolSize()));
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchConnectionManager searchConnectionManager(
        QueryDslProperties properties,
        ObjectProvider<RestTemplateBuilder> restTemplateBuilder,
        ObjectProvider<ObjectMapper> objectMapper
    ) {
        return new SearchConnectionManager(
            properties,
            restTemplateBuilder.getIfAvailable(RestTemplateBuilder::new),
            objectMapper.getIfAvailable(ObjectMapper::new)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryCacheManager queryCacheManager(
        QueryDslProperties properties,
        ObjectProvider<StringRedisTemplate> redisTemplate,
        ObjectProvider<ObjectMapper> objectMapper,
        @Qualifier("queryCacheRefreshExecutor") ExecutorService refreshExecutor
    ) {
        QueryDslProperties.Cache cache = properties.getCache();
        Clock clock = Clock.systemUTC();
        Map<String, ResultCacheStore> stores = new LinkedHashMap<>();
        stores.put(QueryCacheDefaults.MEMORY_STORE, new InMemoryResultCacheStore(cache.getMaxEntries(), clock, refreshExecutor));
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template != null) {
            stores.put(
                QueryCacheDefaults.REDIS_STORE,
                new RedisResultCacheStore(template, objectMapper.getIfAvailable(ObjectMapper::new), clock, refreshExecutor)
            );
        } else if (QueryCacheDefaults.REDIS_STORE.equalsIgnoreCase(cache.getStore())) {
            log.warn("query cache store is redis but no StringRedisTemplate is available");
        }
        return new QueryCacheManager(QueryCacheDefaults.from(cache), stores);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchQueryFactory searchQueryFactory(
        QueryDslProperties properties,
        SearchConnectionManager connectionManager,
        QueryCacheManager cacheManager
    ) {
        QueryContext context = new QueryContext(null, connectionManager, cacheManager, properties.getQuery().getMaxSize());
        return new SearchQueryFactory(context);
    }
}
