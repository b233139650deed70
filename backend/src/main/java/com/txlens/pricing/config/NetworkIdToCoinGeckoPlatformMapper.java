package com.txlens.pricing.config;

import com.txlens.domain.NetworkId;

import java.util.Map;
import java.util.Optional;

/**
 * Maps NetworkId to CoinGecko asset platform id (token prices) and native coin id (gas token price).
 */
public final class NetworkIdToCoinGeckoPlatformMapper {

    private NetworkIdToCoinGeckoPlatformMapper() {}

    private static final Map<NetworkId, String> PLATFORM_IDS = Map.of(
            NetworkId.ETHEREUM, "ethereum",
            NetworkId.ARBITRUM, "arbitrum-one",
            NetworkId.OPTIMISM, "optimistic-ethereum",
            NetworkId.POLYGON, "polygon-pos",
            NetworkId.BASE, "base",
            NetworkId.BSC, "binance-smart-chain",
            NetworkId.AVALANCHE, "avalanche"
    );

    private static final Map<NetworkId, String> NATIVE_COIN_IDS = Map.of(
            NetworkId.ETHEREUM, "ethereum",
            NetworkId.ARBITRUM, "ethereum",
            NetworkId.OPTIMISM, "ethereum",
            NetworkId.BASE, "ethereum",
            NetworkId.POLYGON, "polygon-ecosystem-token",
            NetworkId.BSC, "binancecoin",
            NetworkId.AVALANCHE, "avalanche-2"
    );

    /**
     * @return CoinGecko platform id (e.g. "ethereum", "arbitrum-one") or empty if unknown
     */
    public static Optional<String> toPlatformId(NetworkId networkId) {
        if (networkId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PLATFORM_IDS.get(networkId));
    }

    /**
     * @return CoinGecko coin id of the network's gas token or empty if unknown
     */
    public static Optional<String> toNativeCoinId(NetworkId networkId) {
        if (networkId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(NATIVE_COIN_IDS.get(networkId));
    }
}
