package com.txlens.pricing;

import com.txlens.domain.NetworkId;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Market data source for spot USD prices. Implementations return empty instead of failing when a price is
 * unavailable.
 */
public interface TokenPriceProvider {

    Optional<BigDecimal> tokenPriceUsd(NetworkId networkId, String contractAddress);

    Optional<BigDecimal> nativePriceUsd(NetworkId networkId);

    /** Short identifier recorded as the price source. */
    String sourceName();
}
