package com.txlens.tools;

import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TokenMetadata;
import com.txlens.domain.TokenTransfer;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import com.txlens.rpc.TokenContractReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads name, symbol and decimals of every token contract seen in a transfer. Writes
 * {@link BaggageKeys#TOKEN_METADATA} keyed by lower-case contract address.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenMetadataEnricher implements Tool {

    private final TokenContractReader tokenContractReader;

    @Override
    public String getName() {
        return ToolNames.TOKEN_METADATA_ENRICHER;
    }

    @Override
    public String getDescription() {
        return "Fetches token name, symbol and decimals for every contract involved in a transfer";
    }

    @Override
    public List<String> getDependencies() {
        return List.of(ToolNames.TOKEN_TRANSFER_EXTRACTOR);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        List<TokenTransfer> transfers = baggage.get(BaggageKeys.TRANSFERS).orElse(List.of());
        Set<String> contracts = new LinkedHashSet<>();
        transfers.forEach(t -> contracts.add(t.contract()));
        if (contracts.isEmpty()) {
            baggage.put(BaggageKeys.TOKEN_METADATA, Map.of());
            return;
        }
        RawTransactionData raw = baggage.get(BaggageKeys.RAW_DATA)
                .orElseThrow(() -> new ToolException(getName(), "MISSING_INPUT", "No raw transaction data in baggage"));

        Map<String, TokenMetadata> metadata = new LinkedHashMap<>();
        for (String contract : contracts) {
            context.throwIfCancelled();
            TokenMetadata meta = tokenContractReader.read(raw.networkId(), contract);
            metadata.put(contract, meta);
        }
        log.debug("Resolved metadata for {} token contracts", metadata.size());
        baggage.put(BaggageKeys.TOKEN_METADATA, Collections.unmodifiableMap(metadata));
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        Map<String, TokenMetadata> metadata = baggage.get(BaggageKeys.TOKEN_METADATA).orElse(Map.of());
        if (metadata.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### Token Metadata:");
        metadata.values().forEach(meta -> sb.append("\n- ").append(meta.address()).append(": ")
                .append(meta.hasSymbol() ? meta.symbol() : "unknown symbol")
                .append(meta.name() != null && !meta.name().isBlank() ? " (" + meta.name() + ")" : "")
                .append(", decimals ").append(meta.decimals()));
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        baggage.get(BaggageKeys.TOKEN_METADATA).orElse(Map.of()).values().stream()
                .filter(TokenMetadata::hasSymbol)
                .forEach(meta -> rag.addItem(new RagContextItem(
                        "token:" + meta.address(), "token", meta.symbol() + " token",
                        meta.symbol() + (meta.name() != null && !meta.name().isBlank() ? " (" + meta.name() + ")" : "")
                                + " is the token at " + meta.address() + " with " + meta.decimals() + " decimals.",
                        Map.of("address", meta.address(), "decimals", meta.decimals()),
                        List.of(meta.symbol(), meta.address()), 0.7)));
        return rag;
    }
}
