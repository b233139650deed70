package com.txlens.pipeline.progress;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Display group and title per tool name for progress reporting. Unknown tools fall back to ANALYSIS and a
 * title derived from the name.
 */
public final class ToolCatalog {

    private ToolCatalog() {}

    private static final Map<String, ComponentGroup> GROUPS = Map.ofEntries(
            Map.entry("transaction_context_provider", ComponentGroup.DATA),
            Map.entry("log_decoder", ComponentGroup.DECODING),
            Map.entry("signature_resolver", ComponentGroup.DECODING),
            Map.entry("token_transfer_extractor", ComponentGroup.DECODING),
            Map.entry("ens_resolver", ComponentGroup.ENRICHMENT),
            Map.entry("token_metadata_enricher", ComponentGroup.ENRICHMENT),
            Map.entry("erc20_price_lookup", ComponentGroup.ENRICHMENT),
            Map.entry("monetary_value_enricher", ComponentGroup.ENRICHMENT),
            Map.entry("transaction_explainer", ComponentGroup.ANALYSIS)
    );

    private static final Map<String, String> TITLES = Map.ofEntries(
            Map.entry("transaction_context_provider", "Processing Transaction Data"),
            Map.entry("log_decoder", "Decoding Events"),
            Map.entry("signature_resolver", "Resolving Signatures"),
            Map.entry("token_transfer_extractor", "Extracting Token Transfers"),
            Map.entry("ens_resolver", "Resolving ENS Names"),
            Map.entry("token_metadata_enricher", "Fetching Token Metadata"),
            Map.entry("erc20_price_lookup", "Fetching Token Prices"),
            Map.entry("monetary_value_enricher", "Calculating USD Values"),
            Map.entry("transaction_explainer", "Generating AI Explanation")
    );

    public static ComponentGroup groupOf(String toolName) {
        return GROUPS.getOrDefault(toolName, ComponentGroup.ANALYSIS);
    }

    public static String titleOf(String toolName) {
        String title = TITLES.get(toolName);
        if (title != null) {
            return title;
        }
        if (toolName == null || toolName.isBlank()) {
            return "";
        }
        return Arrays.stream(toolName.split("_"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
                .collect(Collectors.joining(" "));
    }
}
