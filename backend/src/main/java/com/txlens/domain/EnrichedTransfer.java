package com.txlens.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Token transfer with its human-readable amount and USD value, where known.
 *
 * @param amount   amount scaled by token decimals; null for NFTs and tokens without metadata
 * @param valueUsd null when no price is available
 */
public record EnrichedTransfer(
        TransferType type,
        String contract,
        String from,
        String to,
        BigInteger rawAmount,
        BigInteger tokenId,
        String symbol,
        String name,
        Integer decimals,
        BigDecimal amount,
        BigDecimal priceUsd,
        BigDecimal valueUsd
) {

    public static EnrichedTransfer unpriced(TokenTransfer transfer) {
        return new EnrichedTransfer(transfer.type(), transfer.contract(), transfer.from(), transfer.to(),
                transfer.amount(), transfer.tokenId(), null, null, null, null, null, null);
    }
}
