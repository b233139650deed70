package com.txlens.domain;

/**
 * ERC-20 metadata read from the token contract.
 */
public record TokenMetadata(String address, String name, String symbol, int decimals) {

    public static final int DEFAULT_DECIMALS = 18;

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }
}
