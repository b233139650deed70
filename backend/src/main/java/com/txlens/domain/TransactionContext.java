package com.txlens.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Basic transaction facts: who sent it, what it called, value, gas and outcome.
 *
 * @param methodSelector first four bytes of the call data, null for plain transfers
 */
public record TransactionContext(
        String txHash,
        NetworkId networkId,
        String sender,
        String recipient,
        BigInteger valueWei,
        BigInteger gasUsed,
        BigInteger effectiveGasPrice,
        TransactionStatus status,
        Long blockNumber,
        Instant timestamp,
        String methodSelector
) {

    public boolean isContractCall() {
        return methodSelector != null;
    }
}
