package com.txlens.cache;

import java.util.Locale;

/**
 * Key patterns per cache category. Addresses, hashes and selectors are lower-cased so the same fact always
 * maps to the same key. The namespace prefix is added by {@link SimpleToolCache}.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String erc20Price(long chainId, String tokenAddress) {
        return "erc20-price:" + chainId + ":" + normalize(tokenAddress);
    }

    public static String nativePrice(long chainId) {
        return "erc20-price:" + chainId + ":native";
    }

    public static String tokenMetadata(long chainId, String tokenAddress) {
        return "token-meta:" + chainId + ":" + normalize(tokenAddress);
    }

    /** ENS names live on mainnet only, so the key carries no chain id. */
    public static String ensName(String address) {
        return "ens-name:" + normalize(address);
    }

    public static String transactionContext(long chainId, String txHash) {
        return "tx-context:" + chainId + ":" + normalize(txHash);
    }

    public static String fourByteFunctionSignature(String selector) {
        return "4byte-func-sig:" + normalize(selector);
    }

    public static String fourByteEventSignature(String topic) {
        return "4byte-event-sig:" + normalize(topic);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
