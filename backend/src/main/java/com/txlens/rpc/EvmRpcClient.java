package com.txlens.rpc;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries, endpoint rotation and rate limiting live in {@link EvmRpcGateway}.
 */
public interface EvmRpcClient {

    /**
     * Performs a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getTransactionReceipt"
     * @param params      positional params
     * @return raw response body; errors with {@link RpcException} on HTTP or transport failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
