package com.txlens.api.dto;

import com.txlens.api.validation.SupportedNetwork;
import com.txlens.api.validation.TransactionHash;
import com.txlens.domain.TransactionRequest;

/**
 * Body of POST /api/v1/explain and /explain/stream. {@code networkId} is the EVM chain id.
 */
public record ExplainRequest(
        @TransactionHash String txHash,
        @SupportedNetwork Long networkId
) {

    public TransactionRequest toTransactionRequest() {
        return new TransactionRequest(txHash.trim(), networkId);
    }
}
