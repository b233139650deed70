package com.txlens.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.txlens.cache.CacheKeys;
import com.txlens.cache.CacheTtl;
import com.txlens.cache.ToolCache;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads the transaction, its receipt and block header for a hash. Mined transactions never change, so the
 * assembled payload is cached for a year.
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionDataFetcher {

    private final EvmRpcGateway gateway;
    private final ToolCache cache;

    /**
     * @throws TransactionNotFoundException when the node does not know the hash or the transaction is pending
     * @throws RpcException                 when the node cannot be reached
     */
    public RawTransactionData fetch(NetworkId networkId, String txHash) {
        String hash = txHash.strip().toLowerCase();
        String cacheKey = CacheKeys.transactionContext(networkId.getChainId(), hash);
        Optional<RawTransactionData> cached = cache.getJson(cacheKey, RawTransactionData.class);
        if (cached.isPresent()) {
            log.debug("Raw data for {} on {} served from cache", hash, networkId);
            return cached.get();
        }

        JsonNode transaction = gateway.call(networkId, "eth_getTransactionByHash", List.of(hash));
        if (isAbsent(transaction)) {
            throw new TransactionNotFoundException("Transaction " + hash + " not found on " + networkId.getDisplayName());
        }
        JsonNode receipt = gateway.call(networkId, "eth_getTransactionReceipt", List.of(hash));
        if (isAbsent(receipt)) {
            throw new TransactionNotFoundException("Transaction " + hash + " on " + networkId.getDisplayName()
                    + " has no receipt yet (pending?)");
        }
        JsonNode block = null;
        String blockNumber = receipt.path("blockNumber").asText(null);
        if (blockNumber != null) {
            JsonNode header = gateway.call(networkId, "eth_getBlockByNumber", List.of(blockNumber, false));
            block = isAbsent(header) ? null : header;
        }
        List<JsonNode> logs = new ArrayList<>();
        receipt.path("logs").forEach(logs::add);

        RawTransactionData data = new RawTransactionData(hash, networkId, transaction, receipt, block, logs);
        cache.setJson(cacheKey, data, CacheTtl.TRANSACTION);
        log.debug("Fetched {} on {}: {} logs, block {}", hash, networkId, logs.size(), blockNumber);
        return data;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }
}
