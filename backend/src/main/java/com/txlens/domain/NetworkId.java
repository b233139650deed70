package com.txlens.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported EVM network with its chain id, native gas token and block explorer.
 */
public enum NetworkId {
    ETHEREUM(1, "Ethereum", "ETH", "https://etherscan.io", "https://eth.llamarpc.com"),
    OPTIMISM(10, "OP Mainnet", "ETH", "https://optimistic.etherscan.io", "https://mainnet.optimism.io"),
    BSC(56, "BNB Smart Chain", "BNB", "https://bscscan.com", "https://bsc-dataseed.bnbchain.org"),
    POLYGON(137, "Polygon", "POL", "https://polygonscan.com", "https://polygon-rpc.com"),
    BASE(8453, "Base", "ETH", "https://basescan.org", "https://mainnet.base.org"),
    ARBITRUM(42161, "Arbitrum One", "ETH", "https://arbiscan.io", "https://arb1.arbitrum.io/rpc"),
    AVALANCHE(43114, "Avalanche C-Chain", "AVAX", "https://snowtrace.io", "https://api.avax.network/ext/bc/C/rpc");

    private final long chainId;
    private final String displayName;
    private final String nativeSymbol;
    private final String explorerUrl;
    private final String defaultRpcUrl;

    NetworkId(long chainId, String displayName, String nativeSymbol, String explorerUrl, String defaultRpcUrl) {
        this.chainId = chainId;
        this.displayName = displayName;
        this.nativeSymbol = nativeSymbol;
        this.explorerUrl = explorerUrl;
        this.defaultRpcUrl = defaultRpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNativeSymbol() {
        return nativeSymbol;
    }

    public String getExplorerUrl() {
        return explorerUrl;
    }

    /** Public endpoint used when no RPC URL is configured for the network. */
    public String getDefaultRpcUrl() {
        return defaultRpcUrl;
    }

    public String transactionUrl(String txHash) {
        return explorerUrl + "/tx/" + txHash;
    }

    public String addressUrl(String address) {
        return explorerUrl + "/address/" + address;
    }

    public static Optional<NetworkId> fromChainId(long chainId) {
        return Arrays.stream(values())
                .filter(n -> n.chainId == chainId)
                .findFirst();
    }
}
