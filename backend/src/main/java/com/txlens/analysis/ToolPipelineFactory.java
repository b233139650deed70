package com.txlens.analysis;

import com.txlens.cache.ToolCache;
import com.txlens.llm.LlmClient;
import com.txlens.pipeline.BaggagePipeline;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.progress.ProgressSink;
import com.txlens.pricing.TokenPriceProvider;
import com.txlens.rpc.EnsReverseResolver;
import com.txlens.rpc.TokenContractReader;
import com.txlens.signature.SignatureLookup;
import com.txlens.tools.EnsNameResolver;
import com.txlens.tools.Erc20PriceLookup;
import com.txlens.tools.LogDecoder;
import com.txlens.tools.MonetaryValueEnricher;
import com.txlens.tools.SignatureResolver;
import com.txlens.tools.TokenMetadataEnricher;
import com.txlens.tools.TokenTransferExtractor;
import com.txlens.tools.TransactionContextProvider;
import com.txlens.tools.TransactionExplainer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a fully registered pipeline per analysis. Tools are created fresh for every pipeline, so each tool
 * instance belongs to exactly one pipeline. Price lookup is left out when no price provider is configured;
 * the monetary enricher then works from token metadata alone. Signature and ENS resolution are likewise
 * optional.
 */
@Slf4j
public class ToolPipelineFactory {

    private final TokenContractReader tokenContractReader;
    private final TokenPriceProvider priceProvider;
    private final SignatureLookup signatureLookup;
    private final EnsReverseResolver ensReverseResolver;
    private final ToolCache cache;
    private final LlmClient llmClient;
    private final Duration explainerTimeout;

    /**
     * @param priceProvider      null disables price lookup
     * @param signatureLookup    null disables signature resolution
     * @param ensReverseResolver null disables ENS names
     */
    public ToolPipelineFactory(TokenContractReader tokenContractReader, TokenPriceProvider priceProvider,
                               SignatureLookup signatureLookup, EnsReverseResolver ensReverseResolver,
                               ToolCache cache, LlmClient llmClient, Duration explainerTimeout) {
        this.tokenContractReader = tokenContractReader;
        this.priceProvider = priceProvider;
        this.signatureLookup = signatureLookup;
        this.ensReverseResolver = ensReverseResolver;
        this.cache = cache;
        this.llmClient = llmClient;
        this.explainerTimeout = explainerTimeout;
    }

    public boolean isPricingEnabled() {
        return priceProvider != null;
    }

    public BaggagePipeline create(ProgressSink progressSink) {
        List<Tool> contextProviders = new ArrayList<>();
        contextProviders.add(new TransactionContextProvider());
        contextProviders.add(new LogDecoder());
        if (signatureLookup != null) {
            contextProviders.add(new SignatureResolver(signatureLookup, cache));
        }
        contextProviders.add(new TokenTransferExtractor());
        if (ensReverseResolver != null) {
            contextProviders.add(new EnsNameResolver(ensReverseResolver));
        }
        contextProviders.add(new TokenMetadataEnricher(tokenContractReader));
        if (isPricingEnabled()) {
            contextProviders.add(new Erc20PriceLookup(priceProvider, cache));
        }
        contextProviders.add(new MonetaryValueEnricher(isPricingEnabled()));

        BaggagePipeline pipeline = new BaggagePipeline(progressSink);
        pipeline.registerAll(contextProviders);
        pipeline.register(new TransactionExplainer(llmClient, explainerTimeout, contextProviders));
        log.debug("Built pipeline with {} tools (pricing {})", pipeline.getProcessorCount(),
                isPricingEnabled() ? "on" : "off");
        return pipeline;
    }
}
