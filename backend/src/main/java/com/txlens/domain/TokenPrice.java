package com.txlens.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Spot USD price of one token.
 */
public record TokenPrice(String tokenAddress, String symbol, BigDecimal priceUsd, String source, Instant fetchedAt) {
}
