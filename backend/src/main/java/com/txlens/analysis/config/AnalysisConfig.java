package com.txlens.analysis.config;

import com.txlens.analysis.ToolPipelineFactory;
import com.txlens.analysis.TransactionAnalyzer;
import com.txlens.cache.ToolCache;
import com.txlens.llm.LlmClient;
import com.txlens.llm.config.LlmProperties;
import com.txlens.pricing.TokenPriceProvider;
import com.txlens.pricing.config.PricingProperties;
import com.txlens.rpc.EnsReverseResolver;
import com.txlens.rpc.TokenContractReader;
import com.txlens.rpc.TransactionDataFetcher;
import com.txlens.rpc.config.RpcProperties;
import com.txlens.signature.SignatureLookup;
import com.txlens.signature.config.SignatureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfig {

    @Bean
    public ToolPipelineFactory toolPipelineFactory(TokenContractReader tokenContractReader,
                                                   TokenPriceProvider tokenPriceProvider,
                                                   PricingProperties pricingProperties,
                                                   SignatureLookup signatureLookup,
                                                   SignatureProperties signatureProperties,
                                                   EnsReverseResolver ensReverseResolver,
                                                   RpcProperties rpcProperties,
                                                   ToolCache toolCache,
                                                   LlmClient llmClient,
                                                   LlmProperties llmProperties) {
        if (!pricingProperties.isEnabled()) {
            log.info("Pricing disabled: transfers will carry no USD values");
        }
        return new ToolPipelineFactory(tokenContractReader,
                pricingProperties.isEnabled() ? tokenPriceProvider : null,
                signatureProperties.isEnabled() ? signatureLookup : null,
                rpcProperties.getEns().isEnabled() ? ensReverseResolver : null,
                toolCache, llmClient, llmProperties.getTimeout());
    }

    @Bean
    public TransactionAnalyzer transactionAnalyzer(TransactionDataFetcher transactionDataFetcher,
                                                   ToolPipelineFactory toolPipelineFactory,
                                                   AnalysisProperties analysisProperties) {
        return new TransactionAnalyzer(transactionDataFetcher, toolPipelineFactory, analysisProperties.getTimeout());
    }
}
