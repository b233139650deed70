package com.txlens.cache;

/**
 * Thrown when a value cannot be serialized for the cache or the storage backend rejects a write.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
