package com.txlens.pricing.config;

import com.txlens.pricing.CoinGeckoPriceClient;
import com.txlens.pricing.TokenPriceProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Pricing module configuration: properties, the CoinGecko rate limiter and the price provider.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean(name = "coingeckoRateLimiter")
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, pricingProperties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofSeconds(pricingProperties.getConnectTimeoutSeconds()))
                .build();
        return RateLimiter.of("coingecko", config);
    }

    @Bean
    public TokenPriceProvider tokenPriceProvider(PricingProperties pricingProperties, WebClient.Builder webClientBuilder,
                                                 @Qualifier("coingeckoRateLimiter") RateLimiter coingeckoRateLimiter) {
        return new CoinGeckoPriceClient(pricingProperties, webClientBuilder, coingeckoRateLimiter);
    }
}
