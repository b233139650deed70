package com.txlens.domain;

/**
 * Transaction to analyze: hash and chain id.
 */
public record TransactionRequest(String txHash, long networkId) {
}
