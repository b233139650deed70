package com.txlens.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final answer for one transaction: the generated explanation plus the structured facts it was built from.
 */
public record ExplanationResult(
        String txHash,
        long networkId,
        String networkName,
        String summary,
        TransactionStatus status,
        String sender,
        String recipient,
        Long blockNumber,
        Instant timestamp,
        List<EnrichedTransfer> transfers,
        GasFee gasFee,
        Map<String, String> links,
        List<String> tags
) {

    public ExplanationResult {
        transfers = transfers != null ? List.copyOf(transfers) : List.of();
        links = links != null ? Map.copyOf(links) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
