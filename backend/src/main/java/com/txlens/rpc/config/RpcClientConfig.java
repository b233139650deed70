package com.txlens.rpc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.cache.ToolCache;
import com.txlens.common.RetryPolicy;
import com.txlens.domain.NetworkId;
import com.txlens.rpc.EnsReverseResolver;
import com.txlens.rpc.EvmRpcClient;
import com.txlens.rpc.EvmRpcGateway;
import com.txlens.rpc.RpcEndpointRegistry;
import com.txlens.rpc.RpcEndpointRotator;
import com.txlens.rpc.TokenContractReader;
import com.txlens.rpc.TransactionDataFetcher;
import com.txlens.rpc.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * RPC wiring: one rotator per supported network (configured URLs or the network's public default), the
 * WebClient transport, a shared Resilience4j rate limiter and the gateway on top.
 */
@Configuration
@EnableConfigurationProperties(RpcProperties.class)
@Slf4j
public class RpcClientConfig {

    @Bean
    public RpcEndpointRegistry rpcEndpointRegistry(RpcProperties properties) {
        RpcProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                retry.getJitterFactor(), retry.getMaxAttempts());
        Map<NetworkId, RpcEndpointRotator> rotators = new EnumMap<>(NetworkId.class);
        for (NetworkId networkId : NetworkId.values()) {
            RpcProperties.NetworkEntry entry = properties.getNetwork().get(networkId.name());
            List<String> urls = entry != null && !entry.getUrls().isEmpty()
                    ? entry.getUrls()
                    : List.of(networkId.getDefaultRpcUrl());
            rotators.put(networkId, new RpcEndpointRotator(urls, retryPolicy));
            log.debug("RPC endpoints for {}: {}", networkId, urls.size());
        }
        return new RpcEndpointRegistry(rotators);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(RpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public EvmRpcGateway evmRpcGateway(EvmRpcClient evmRpcClient, RpcEndpointRegistry rpcEndpointRegistry,
                                       @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                                       ObjectMapper objectMapper,
                                       RpcProperties properties) {
        return new EvmRpcGateway(evmRpcClient, rpcEndpointRegistry, evmRpcRateLimiter, objectMapper,
                properties.getCallTimeout(), properties.getRateLimitCooldown());
    }

    @Bean
    public TransactionDataFetcher transactionDataFetcher(EvmRpcGateway evmRpcGateway, ToolCache toolCache) {
        return new TransactionDataFetcher(evmRpcGateway, toolCache);
    }

    @Bean
    public TokenContractReader tokenContractReader(EvmRpcGateway evmRpcGateway, ToolCache toolCache) {
        return new TokenContractReader(evmRpcGateway, toolCache);
    }

    @Bean
    public EnsReverseResolver ensReverseResolver(EvmRpcGateway evmRpcGateway, ToolCache toolCache) {
        return new EnsReverseResolver(evmRpcGateway, toolCache);
    }
}
