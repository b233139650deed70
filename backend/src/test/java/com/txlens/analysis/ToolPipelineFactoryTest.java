package com.txlens.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.cache.CaffeineKeyValueConnector;
import com.txlens.cache.SimpleToolCache;
import com.txlens.llm.LlmClient;
import com.txlens.pipeline.BaggagePipeline;
import com.txlens.pricing.TokenPriceProvider;
import com.txlens.rpc.EnsReverseResolver;
import com.txlens.rpc.TokenContractReader;
import com.txlens.signature.SignatureLookup;
import com.txlens.tools.ToolNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class ToolPipelineFactoryTest {

    @Mock
    private TokenContractReader tokenContractReader;

    @Mock
    private TokenPriceProvider priceProvider;

    @Mock
    private LlmClient llmClient;

    @Mock
    private SignatureLookup signatureLookup;

    @Mock
    private EnsReverseResolver ensReverseResolver;

    private final SimpleToolCache cache =
            new SimpleToolCache(new CaffeineKeyValueConnector(10), new ObjectMapper(), "txlens", null);

    @Test
    void create_withPricing_ordersEveryTool() {
        ToolPipelineFactory factory = new ToolPipelineFactory(tokenContractReader, priceProvider, null, null, cache, llmClient,
                Duration.ofSeconds(30));

        BaggagePipeline pipeline = factory.create(null);

        assertThat(factory.isPricingEnabled()).isTrue();
        assertThat(pipeline.getExecutionOrder()).containsExactly(
                ToolNames.TRANSACTION_CONTEXT_PROVIDER,
                ToolNames.LOG_DECODER,
                ToolNames.TOKEN_TRANSFER_EXTRACTOR,
                ToolNames.TOKEN_METADATA_ENRICHER,
                ToolNames.ERC20_PRICE_LOOKUP,
                ToolNames.MONETARY_VALUE_ENRICHER,
                ToolNames.TRANSACTION_EXPLAINER);
        pipeline.validateAllDependencies();
    }

    @Test
    void create_withSignaturesAndEns_insertsBothAfterTheirInputs() {
        ToolPipelineFactory factory = new ToolPipelineFactory(tokenContractReader, priceProvider, signatureLookup,
                ensReverseResolver, cache, llmClient, Duration.ofSeconds(30));

        BaggagePipeline pipeline = factory.create(null);

        assertThat(pipeline.getExecutionOrder()).containsExactly(
                ToolNames.TRANSACTION_CONTEXT_PROVIDER,
                ToolNames.LOG_DECODER,
                ToolNames.SIGNATURE_RESOLVER,
                ToolNames.TOKEN_TRANSFER_EXTRACTOR,
                ToolNames.ENS_RESOLVER,
                ToolNames.TOKEN_METADATA_ENRICHER,
                ToolNames.ERC20_PRICE_LOOKUP,
                ToolNames.MONETARY_VALUE_ENRICHER,
                ToolNames.TRANSACTION_EXPLAINER);
        assertThat(pipeline.getTool(ToolNames.TRANSACTION_EXPLAINER))
                .hasValueSatisfying(tool -> assertThat(tool.getDependencies()).hasSize(8)
                        .contains(ToolNames.SIGNATURE_RESOLVER, ToolNames.ENS_RESOLVER));
        pipeline.validateAllDependencies();
    }

    @Test
    void create_withoutPricing_leavesPriceLookupOut() {
        ToolPipelineFactory factory = new ToolPipelineFactory(tokenContractReader, null, null, null, cache, llmClient,
                Duration.ofSeconds(30));

        BaggagePipeline pipeline = factory.create(null);

        assertThat(factory.isPricingEnabled()).isFalse();
        assertThat(pipeline.hasTool(ToolNames.ERC20_PRICE_LOOKUP)).isFalse();
        assertThat(pipeline.getProcessorCount()).isEqualTo(6);
        assertThat(pipeline.describeExecutionPlan())
                .filteredOn(e -> e.toolName().equals(ToolNames.MONETARY_VALUE_ENRICHER))
                .singleElement()
                .satisfies(entry -> assertThat(entry.dependencies())
                        .containsExactly(ToolNames.TOKEN_METADATA_ENRICHER, ToolNames.TRANSACTION_CONTEXT_PROVIDER));
    }

    @Test
    void create_explainerDependsOnEveryContextProvider() {
        ToolPipelineFactory factory = new ToolPipelineFactory(tokenContractReader, priceProvider, null, null, cache, llmClient,
                Duration.ofSeconds(30));

        BaggagePipeline pipeline = factory.create(null);

        assertThat(pipeline.getTool(ToolNames.TRANSACTION_EXPLAINER))
                .hasValueSatisfying(tool -> assertThat(tool.getDependencies()).hasSize(6)
                        .doesNotContain(ToolNames.TRANSACTION_EXPLAINER));
    }

    @Test
    void create_returnsIndependentPipelines() {
        ToolPipelineFactory factory = new ToolPipelineFactory(tokenContractReader, priceProvider, null, null, cache, llmClient,
                Duration.ofSeconds(30));

        BaggagePipeline first = factory.create(null);
        BaggagePipeline second = factory.create(null);

        assertThat(first.getTool(ToolNames.LOG_DECODER).orElseThrow())
                .isNotSameAs(second.getTool(ToolNames.LOG_DECODER).orElseThrow());
    }
}
