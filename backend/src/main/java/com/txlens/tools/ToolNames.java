package com.txlens.tools;

/**
 * Stable tool names. They double as dependency references and progress component ids.
 */
public final class ToolNames {

    private ToolNames() {}

    public static final String TRANSACTION_CONTEXT_PROVIDER = "transaction_context_provider";
    public static final String LOG_DECODER = "log_decoder";
    public static final String SIGNATURE_RESOLVER = "signature_resolver";
    public static final String TOKEN_TRANSFER_EXTRACTOR = "token_transfer_extractor";
    public static final String ENS_RESOLVER = "ens_resolver";
    public static final String TOKEN_METADATA_ENRICHER = "token_metadata_enricher";
    public static final String ERC20_PRICE_LOOKUP = "erc20_price_lookup";
    public static final String MONETARY_VALUE_ENRICHER = "monetary_value_enricher";
    public static final String TRANSACTION_EXPLAINER = "transaction_explainer";
}
