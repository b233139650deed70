package com.txlens.rpc;

import com.txlens.common.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection over one network's RPC endpoints. An endpoint that answered with a rate limit can be
 * parked for a cool-down; it is skipped until then unless every endpoint is parked.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;
    private final Map<String, Instant> coolingDownUntil = new ConcurrentHashMap<>();
    private final Clock clock;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        this(endpoints, retryPolicy, Clock.systemUTC());
    }

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, Clock clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.clock = clock;
    }

    /**
     * Next available endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        Instant now = clock.instant();
        for (int tries = 0; tries < endpoints.size(); tries++) {
            String candidate = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            Instant until = coolingDownUntil.get(candidate);
            if (until == null || !now.isBefore(until)) {
                coolingDownUntil.remove(candidate, until);
                return candidate;
            }
        }
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    public void markCoolingDown(String endpoint, Duration cooldown) {
        if (endpoints.contains(endpoint)) {
            coolingDownUntil.put(endpoint, clock.instant().plus(cooldown));
        }
    }

    public boolean isCoolingDown(String endpoint) {
        Instant until = coolingDownUntil.get(endpoint);
        return until != null && clock.instant().isBefore(until);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
