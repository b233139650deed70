package com.txlens.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Raw JSON-RPC payloads for one transaction: the transaction object, its receipt, the enclosing block header
 * and the receipt logs. Seeded into the pipeline before any tool runs.
 */
public record RawTransactionData(
        String txHash,
        NetworkId networkId,
        JsonNode transaction,
        JsonNode receipt,
        JsonNode block,
        List<JsonNode> logs
) {

    public RawTransactionData {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }
}
