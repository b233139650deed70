package com.txlens.cache;

import java.time.Duration;

/**
 * Time to live per cache category.
 */
public final class CacheTtl {

    private CacheTtl() {}

    /** Function and event signatures never change once published. */
    public static final Duration SIGNATURE = Duration.ofDays(365);
    public static final Duration TOKEN_METADATA = Duration.ofDays(365);
    public static final Duration TRANSACTION = Duration.ofDays(365);

    public static final Duration PRICE = Duration.ofHours(1);

    /** Reverse records can be changed by their owner at any time. */
    public static final Duration ENS = Duration.ofDays(30);
}
