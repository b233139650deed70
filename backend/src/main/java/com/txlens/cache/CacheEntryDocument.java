package com.txlens.cache;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One cache entry in MongoDB. {@code expiresAt} is null for entries without TTL; a TTL index on it lets
 * MongoDB evict expired entries in the background.
 */
@Document(collection = "tool_cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheEntryDocument {

    @Id
    private String key;
    private byte[] value;
    private Instant expiresAt;
    private Instant updatedAt;
}
