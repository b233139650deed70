package com.txlens.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage backend behind {@link ToolCache}. Values are opaque bytes; implementations must be safe for
 * concurrent use and must report an expired entry as absent.
 */
public interface KeyValueConnector {

    Optional<byte[]> get(String key);

    /**
     * Stores or overwrites a value.
     *
     * @param ttl time to live; null means the entry does not expire
     */
    void set(String key, byte[] value, Duration ttl);
}
