package com.txlens.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.txlens.cache.CacheKeys;
import com.txlens.cache.CacheTtl;
import com.txlens.cache.ToolCache;
import com.txlens.common.EvmHex;
import com.txlens.domain.NetworkId;
import com.txlens.domain.TokenMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads ERC-20 name, symbol and decimals via eth_call. Metadata is cached per (chain, token) only when the
 * symbol was read and the decimals are known; a failed decimals read falls back to
 * {@link TokenMetadata#DEFAULT_DECIMALS} and is not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenContractReader {

    /** keccak256("decimals()")[0..4] */
    static final String DECIMALS_SELECTOR = "0x313ce567";
    /** keccak256("symbol()")[0..4] */
    static final String SYMBOL_SELECTOR = "0x95d89b41";
    /** keccak256("name()")[0..4] */
    static final String NAME_SELECTOR = "0x06fdde03";

    private static final Map<String, Integer> KNOWN_DECIMALS = Map.of(
            "ETHEREUM:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", 6,
            "ETHEREUM:0xdac17f958d2ee523a2206206994597c13d831ec7", 6,
            "ETHEREUM:0x2260fac5e5542a773aa44fbcfedf7c193bc2c599", 8,
            "ARBITRUM:0xaf88d065e77c8cc2239327c5edb3a432268e5831", 6,
            "ARBITRUM:0x2f2a2543b76a4166549f7aab2e75bef0aefc5b0f", 8,
            "BASE:0x833589fcd6edb6e08f4c7c32d4f71b54bda02913", 6,
            "OPTIMISM:0x0b2c639c533813f4aa9d7837caf62653d097ff85", 6,
            "POLYGON:0x3c499c542cef5e3811e1192ce70d8cc03d5c3359", 6
    );

    private final EvmRpcGateway gateway;
    private final ToolCache cache;

    public TokenMetadata read(NetworkId networkId, String tokenAddress) {
        String address = tokenAddress.strip().toLowerCase(Locale.ROOT);
        String cacheKey = CacheKeys.tokenMetadata(networkId.getChainId(), address);
        Optional<TokenMetadata> cached = cache.getJson(cacheKey, TokenMetadata.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        String symbol = callString(networkId, address, SYMBOL_SELECTOR);
        String name = callString(networkId, address, NAME_SELECTOR);
        Optional<Integer> decimals = readDecimals(networkId, address);
        TokenMetadata meta = new TokenMetadata(address, name, symbol,
                decimals.orElse(TokenMetadata.DEFAULT_DECIMALS));
        if (meta.hasSymbol() && decimals.isPresent()) {
            cache.setJson(cacheKey, meta, CacheTtl.TOKEN_METADATA);
        } else {
            log.debug("Incomplete metadata for {} on {} (symbol={}, decimals read={}); not cached",
                    address, networkId, meta.hasSymbol(), decimals.isPresent());
        }
        return meta;
    }

    /**
     * @return decimals from the known-token table or a successful {@code decimals()} call; empty when the call
     * failed or returned a value outside 0..255
     */
    private Optional<Integer> readDecimals(NetworkId networkId, String address) {
        Integer known = KNOWN_DECIMALS.get(networkId.name() + ":" + address);
        if (known != null) {
            return Optional.of(known);
        }
        BigInteger value = ethCall(networkId, address, DECIMALS_SELECTOR).map(EvmHex::toBigInteger).orElse(null);
        if (value == null || value.signum() < 0 || value.compareTo(BigInteger.valueOf(255)) > 0) {
            return Optional.empty();
        }
        return Optional.of(value.intValue());
    }

    private String callString(NetworkId networkId, String address, String selector) {
        return ethCall(networkId, address, selector).map(EvmHex::decodeAbiString).orElse("");
    }

    private Optional<String> ethCall(NetworkId networkId, String address, String selector) {
        List<Object> params = List.of(Map.of("to", address, "data", selector), "latest");
        try {
            JsonNode result = gateway.call(networkId, "eth_call", params);
            String hex = result.asText(null);
            if (hex == null || !hex.startsWith("0x") || hex.length() <= 2) {
                return Optional.empty();
            }
            return Optional.of(hex);
        } catch (RpcException e) {
            log.debug("eth_call {} failed for {} on {}: {}", selector, address, networkId, e.getMessage());
            return Optional.empty();
        }
    }
}
