package com.txlens.cache.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tool cache configuration. Documented in application.yml under txlens.cache.
 */
@ConfigurationProperties(prefix = "txlens.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** Storage backend: caffeine (in-process) or mongo (shared across instances). */
    private Backend backend = Backend.CAFFEINE;

    /** Namespace prepended to every key as {@code prefix:key}. */
    private String keyPrefix = "txlens";

    /** TTL for writes that pass none. Null keeps such entries until evicted. */
    private Duration defaultTtl;

    /** Maximum entries held by the Caffeine backend. */
    private long maximumSize = 100_000;

    /** MongoDB collection for the mongo backend. */
    private String mongoCollection = "tool_cache";

    public enum Backend {
        CAFFEINE,
        MONGO
    }
}
