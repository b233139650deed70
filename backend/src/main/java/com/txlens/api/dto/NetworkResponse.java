package com.txlens.api.dto;

import com.txlens.domain.NetworkId;

public record NetworkResponse(long chainId, String id, String name, String nativeSymbol, String explorerUrl) {

    public static NetworkResponse from(NetworkId network) {
        return new NetworkResponse(network.getChainId(), network.name(), network.getDisplayName(),
                network.getNativeSymbol(), network.getExplorerUrl());
    }
}
