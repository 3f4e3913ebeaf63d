package com.storesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storesync.deploy.ReportStorage;
import com.storesync.desired.DesiredConfigLoader;
import com.storesync.domain.Attribute;
import com.storesync.domain.Category;
import com.storesync.domain.Channel;
import com.storesync.domain.Product;
import com.storesync.domain.ProductType;
import com.storesync.domain.Warehouse;
import com.storesync.reconcile.EntityRepository;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.GraphQLClient;
import com.storesync.remote.GraphQLEntityRepository;
import com.storesync.remote.RemoteReferenceResolver;
import com.storesync.remote.WebClientGraphQLClient;
import com.storesync.remote.mapping.AttributeMapping;
import com.storesync.remote.mapping.CategoryMapping;
import com.storesync.remote.mapping.ChannelMapping;
import com.storesync.remote.mapping.ProductMapping;
import com.storesync.remote.mapping.ProductTypeMapping;
import com.storesync.remote.mapping.WarehouseMapping;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * GraphQL client, per-family repositories and file-based collaborators.
 */
@Configuration
public class ClientConfig {

    @Bean(name = "graphqlRequestLimiter")
    public RateLimiter graphqlRequestLimiter(ApiProperties apiProperties) {
        int rps = Math.max(1, apiProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, apiProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("graphql-api", config);
    }

    @Bean
    public GraphQLClient graphQLClient(WebClient.Builder webClientBuilder, ApiProperties apiProperties,
                                       RateLimiter graphqlRequestLimiter, ObjectMapper objectMapper) {
        return new WebClientGraphQLClient(webClientBuilder, apiProperties.getUrl(), apiProperties.getToken(),
                graphqlRequestLimiter, objectMapper, Duration.ofMillis(Math.max(1L, apiProperties.getRequestTimeoutMs())));
    }

    @Bean
    public RemoteReferenceResolver remoteReferenceResolver() {
        return new RemoteReferenceResolver();
    }

    @Bean
    public EntityRepository<Channel> channelRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new ChannelMapping(), resolver, cacheManager);
    }

    @Bean
    public EntityRepository<Warehouse> warehouseRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new WarehouseMapping(), resolver, cacheManager);
    }

    @Bean
    public EntityRepository<Attribute> attributeRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new AttributeMapping(), resolver, cacheManager);
    }

    @Bean
    public EntityRepository<ProductType> productTypeRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new ProductTypeMapping(), resolver, cacheManager);
    }

    @Bean
    public EntityRepository<Category> categoryRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new CategoryMapping(), resolver, cacheManager);
    }

    @Bean
    public EntityRepository<Product> productRepository(GraphQLClient client, RemoteReferenceResolver resolver, CacheManager cacheManager) {
        return repository(client, new ProductMapping(), resolver, cacheManager);
    }

    @Bean
    public ReportStorage reportStorage(ReportProperties reportProperties) {
        return new ReportStorage(Path.of(reportProperties.getDirectory()), reportProperties.getMaxReports());
    }

    @Bean
    public DesiredConfigLoader desiredConfigLoader() {
        return new DesiredConfigLoader();
    }

    private static <T> GraphQLEntityRepository<T> repository(GraphQLClient client, EntityMapping<T> mapping,
                                                             RemoteReferenceResolver resolver, CacheManager cacheManager) {
        GraphQLEntityRepository<T> repository = new GraphQLEntityRepository<>(client, mapping, resolver,
                cacheManager.getCache(CaffeineConfig.REMOTE_ENTITY_CACHE));
        resolver.register(repository);
        return repository;
    }
}
