package com.txlens.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.domain.NetworkId;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Blocking JSON-RPC calls for one network with endpoint rotation, exponential backoff and a process-wide
 * rate limit. Retries only failures that {@link RpcException#isRetryable()} accepts; an endpoint that
 * answered HTTP 429 is parked for the configured cool-down.
 */
@Slf4j
public class EvmRpcGateway {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRegistry endpoints;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;
    private final Duration rateLimitCooldown;

    public EvmRpcGateway(EvmRpcClient rpcClient, RpcEndpointRegistry endpoints, RateLimiter rateLimiter,
                         ObjectMapper objectMapper, Duration callTimeout, Duration rateLimitCooldown) {
        this.rpcClient = rpcClient;
        this.endpoints = endpoints;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.callTimeout = callTimeout;
        this.rateLimitCooldown = rateLimitCooldown;
    }

    /**
     * @return the {@code result} member of the response; a JSON null node when the node returned null
     * @throws RpcException when every attempt failed or the node returned a non-retryable error
     */
    public JsonNode call(NetworkId networkId, String method, Object params) {
        RpcEndpointRotator rotator = endpoints.rotatorFor(networkId);
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (RpcException e) {
                lastException = e;
                if (e.getHttpStatus() == 429) {
                    rotator.markCoolingDown(endpoint, rateLimitCooldown);
                }
                if (!e.isRetryable()) {
                    throw e;
                }
                log.warn("{} on {} failed (attempt {}/{}): {}", method, endpoint, attempt + 1,
                        rotator.getMaxAttempts(), e.getMessage());
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts on "
                + networkId + ": " + lastException.getMessage(), lastException.getHttpStatus(),
                lastException.getRpcCode(), lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local RPC rate limit exceeded for " + method);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block(callTimeout);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout this way
            throw new RpcException(method + " timed out after " + callTimeout.toMillis() + "ms", e);
        }
        if (json == null) {
            throw new RpcException(method + " returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned malformed JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            int code = error.path("code").asInt();
            throw new RpcException(method + " error " + code + ": " + error.path("message").asText(), 200, code, null);
        }
        return root.path("result");
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }
}
