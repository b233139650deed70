package com.txlens.rpc;

import com.txlens.domain.NetworkId;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link RpcEndpointRotator} per configured network.
 */
public class RpcEndpointRegistry {

    private final Map<NetworkId, RpcEndpointRotator> rotators;

    public RpcEndpointRegistry(Map<NetworkId, RpcEndpointRotator> rotators) {
        this.rotators = rotators.isEmpty() ? new EnumMap<>(NetworkId.class) : new EnumMap<>(rotators);
    }

    public Optional<RpcEndpointRotator> find(NetworkId networkId) {
        return Optional.ofNullable(rotators.get(networkId));
    }

    /**
     * @throws RpcException when the network has no endpoints
     */
    public RpcEndpointRotator rotatorFor(NetworkId networkId) {
        return find(networkId)
                .orElseThrow(() -> new RpcException("No RPC endpoints configured for " + networkId));
    }
}
