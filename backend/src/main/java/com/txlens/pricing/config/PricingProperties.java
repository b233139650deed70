package com.txlens.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spot price lookup settings, bound from {@code txlens.pricing}.
 */
@ConfigurationProperties(prefix = "txlens.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * When false the price lookup step is left out and transfers carry no USD values.
     */
    private boolean enabled = true;

    /** Public or pro CoinGecko endpoint; the demo key works against the public one. */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Optional CoinGecko demo API key.
     */
    private String apiKey;

    /**
     * Token bucket: requests per minute (the public tier allows roughly 30).
     */
    private int requestsPerMinute = 25;

    private int connectTimeoutSeconds = 10;

    /** Applies per price request, including the native coin lookup. */
    private int readTimeoutSeconds = 15;
}
