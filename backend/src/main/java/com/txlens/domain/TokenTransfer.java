package com.txlens.domain;

import java.math.BigInteger;

/**
 * Token movement extracted from a transfer event. {@code amount} is the raw on-chain integer (1 for ERC-721);
 * {@code tokenId} is null for ERC-20.
 */
public record TokenTransfer(
        TransferType type,
        String contract,
        String from,
        String to,
        BigInteger amount,
        BigInteger tokenId,
        long logIndex
) {

    public boolean isFungible() {
        return type == TransferType.ERC20;
    }
}
