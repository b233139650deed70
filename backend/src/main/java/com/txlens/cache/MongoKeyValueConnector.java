package com.txlens.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Shared connector storing one {@link CacheEntryDocument} per key. The TTL monitor of MongoDB runs about once
 * a minute, so expiry is also checked on every read.
 */
@Slf4j
public class MongoKeyValueConnector implements KeyValueConnector {

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final Clock clock;

    public MongoKeyValueConnector(MongoTemplate mongoTemplate, String collection) {
        this(mongoTemplate, collection, Clock.systemUTC());
    }

    public MongoKeyValueConnector(MongoTemplate mongoTemplate, String collection, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
        this.clock = clock;
    }

    /** Creates the TTL index on {@code expiresAt} if it does not exist yet. */
    public void ensureIndexes() {
        mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on("expiresAt", Sort.Direction.ASC)
                .named("expiresAt_ttl")
                .expire(0, TimeUnit.SECONDS));
        log.info("Cache collection '{}' ready with TTL index on expiresAt", collection);
    }

    @Override
    public Optional<byte[]> get(String key) {
        CacheEntryDocument doc = mongoTemplate.findById(key, CacheEntryDocument.class, collection);
        if (doc == null || doc.getValue() == null) {
            return Optional.empty();
        }
        if (doc.getExpiresAt() != null && !clock.instant().isBefore(doc.getExpiresAt())) {
            return Optional.empty();
        }
        return Optional.of(doc.getValue());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (value == null) {
            throw new CacheException("Cache value for '" + key + "' must not be null");
        }
        Instant now = clock.instant();
        CacheEntryDocument doc = new CacheEntryDocument();
        doc.setKey(key);
        doc.setValue(value);
        doc.setUpdatedAt(now);
        doc.setExpiresAt(ttl == null ? null : now.plus(ttl));
        try {
            mongoTemplate.save(doc, collection);
        } catch (DataAccessException e) {
            throw new CacheException("Failed to write cache entry " + key, e);
        }
    }
}
