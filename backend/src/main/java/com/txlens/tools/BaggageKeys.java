package com.txlens.tools;

import com.txlens.domain.DecodedEvent;
import com.txlens.domain.EnrichedTransfer;
import com.txlens.domain.GasFee;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.ResolvedSignature;
import com.txlens.domain.TokenMetadata;
import com.txlens.domain.TokenPrice;
import com.txlens.domain.TokenTransfer;
import com.txlens.domain.TransactionContext;
import com.txlens.pipeline.BaggageKey;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Baggage slots shared by the analysis tools. The string names are the contract between a writer and its
 * readers; each slot lists the tool that writes it.
 */
public final class BaggageKeys {

    private BaggageKeys() {}

    /** Seeded by the analyzer before the run. */
    public static final BaggageKey<RawTransactionData> RAW_DATA = BaggageKey.of("raw_data", RawTransactionData.class);

    /** transaction_context_provider */
    public static final BaggageKey<TransactionContext> TRANSACTION_CONTEXT =
            BaggageKey.of("transaction_context", TransactionContext.class);

    /** log_decoder */
    public static final BaggageKey<List<DecodedEvent>> EVENTS = BaggageKey.ofGeneric("events", List.class);

    /** signature_resolver; the transaction's selector first, then unknown event topics. */
    public static final BaggageKey<List<ResolvedSignature>> RESOLVED_SIGNATURES =
            BaggageKey.ofGeneric("resolved_signatures", List.class);

    /** token_transfer_extractor */
    public static final BaggageKey<List<TokenTransfer>> TRANSFERS = BaggageKey.ofGeneric("transfers", List.class);

    /** ens_resolver; primary names keyed by lower-case address, only addresses that have one. */
    public static final BaggageKey<Map<String, String>> ENS_NAMES = BaggageKey.ofGeneric("ens_names", Map.class);

    /** token_metadata_enricher; keyed by lower-case contract address. */
    public static final BaggageKey<Map<String, TokenMetadata>> TOKEN_METADATA =
            BaggageKey.ofGeneric("token_metadata", Map.class);

    /** erc20_price_lookup; keyed by lower-case contract address. */
    public static final BaggageKey<Map<String, TokenPrice>> TOKEN_PRICES =
            BaggageKey.ofGeneric("token_prices", Map.class);

    /** erc20_price_lookup; USD price of the network's gas token. */
    public static final BaggageKey<BigDecimal> NATIVE_TOKEN_PRICE =
            BaggageKey.of("native_token_price", BigDecimal.class);

    /** monetary_value_enricher */
    public static final BaggageKey<List<EnrichedTransfer>> ENRICHED_TRANSFERS =
            BaggageKey.ofGeneric("enriched_transfers", List.class);

    /** monetary_value_enricher */
    public static final BaggageKey<GasFee> GAS_FEE = BaggageKey.of("gas_fee", GasFee.class);

    /** transaction_explainer */
    public static final BaggageKey<String> EXPLANATION = BaggageKey.of("explanation", String.class);
}
