package com.txlens.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.cache.CaffeineKeyValueConnector;
import com.txlens.cache.KeyValueConnector;
import com.txlens.cache.MongoKeyValueConnector;
import com.txlens.cache.SimpleToolCache;
import com.txlens.cache.ToolCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Wires the tool cache: one {@link KeyValueConnector} chosen by {@code txlens.cache.backend} and the
 * namespaced {@link ToolCache} on top of it.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
@Slf4j
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "txlens.cache", name = "backend", havingValue = "caffeine", matchIfMissing = true)
    public KeyValueConnector caffeineKeyValueConnector(CacheProperties properties) {
        log.info("Tool cache backend: caffeine (maximum size {})", properties.getMaximumSize());
        return new CaffeineKeyValueConnector(properties.getMaximumSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "txlens.cache", name = "backend", havingValue = "mongo")
    public KeyValueConnector mongoKeyValueConnector(CacheProperties properties, MongoTemplate mongoTemplate) {
        log.info("Tool cache backend: mongo (collection {})", properties.getMongoCollection());
        MongoKeyValueConnector connector = new MongoKeyValueConnector(mongoTemplate, properties.getMongoCollection());
        connector.ensureIndexes();
        return connector;
    }

    @Bean
    public ToolCache toolCache(KeyValueConnector connector, ObjectMapper objectMapper, CacheProperties properties) {
        return new SimpleToolCache(connector, objectMapper, properties.getKeyPrefix(), properties.getDefaultTtl());
    }
}
