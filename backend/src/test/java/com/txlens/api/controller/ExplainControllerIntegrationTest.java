package com.txlens.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.cache.CacheEntryDocument;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TokenMetadata;
import com.txlens.llm.ChatMessage;
import com.txlens.llm.LlmClient;
import com.txlens.pricing.TokenPriceProvider;
import com.txlens.rpc.EnsReverseResolver;
import com.txlens.rpc.TokenContractReader;
import com.txlens.rpc.TransactionDataFetcher;
import com.txlens.signature.SignatureLookup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "txlens.cache.backend=mongo",
        "txlens.pricing.enabled=true",
        "txlens.llm.api-key=test-key"
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class ExplainControllerIntegrationTest {

    private static final String HASH = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String ALICE = "0x1111111111111111111111111111111111111111";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    TransactionDataFetcher transactionDataFetcher;
    @MockBean
    TokenContractReader tokenContractReader;
    @MockBean
    TokenPriceProvider tokenPriceProvider;
    @MockBean
    LlmClient llmClient;
    @MockBean
    SignatureLookup signatureLookup;
    @MockBean
    EnsReverseResolver ensReverseResolver;

    @Test
    @DisplayName("explain runs the full tool pipeline and caches prices in MongoDB")
    @SuppressWarnings("unchecked")
    void explainEndToEnd() throws Exception {
        when(transactionDataFetcher.fetch(NetworkId.ETHEREUM, HASH)).thenReturn(raw());
        when(tokenContractReader.read(NetworkId.ETHEREUM, USDC)).thenReturn(new TokenMetadata(USDC, "USD Coin", "USDC", 6));
        when(tokenPriceProvider.tokenPriceUsd(NetworkId.ETHEREUM, USDC)).thenReturn(Optional.of(new BigDecimal("1.00")));
        when(tokenPriceProvider.nativePriceUsd(NetworkId.ETHEREUM)).thenReturn(Optional.of(new BigDecimal("3000")));
        when(tokenPriceProvider.sourceName()).thenReturn("coingecko");
        when(signatureLookup.functionSignature("0xa9059cbb")).thenReturn(Optional.of("transfer(address,uint256)"));
        when(signatureLookup.sourceName()).thenReturn("4byte");
        when(ensReverseResolver.reverseName(ALICE)).thenReturn(Optional.of("alice.eth"));
        when(llmClient.complete(anyList(), any(Duration.class))).thenReturn("Sent 5 USDC + $0.14 gas.");

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.summary").isEqualTo("Sent 5 USDC + $0.14 gas.")
                .jsonPath("$.transfers[0].symbol").isEqualTo("USDC")
                .jsonPath("$.transfers[0].valueUsd").isEqualTo(5.0)
                .jsonPath("$.gasFee.nativeSymbol").isEqualTo("ETH")
                .jsonPath("$.gasFee.feeUsd").isEqualTo(0.14)
                .jsonPath("$.tags[0]").isEqualTo("contract-call")
                .jsonPath("$.tags[1]").isEqualTo("token-transfer");

        CacheEntryDocument price = mongoTemplate.findById("txlens:erc20-price:1:" + USDC, CacheEntryDocument.class, "tool_cache");
        assertThat(price).isNotNull();
        assertThat(price.getExpiresAt()).isAfter(price.getUpdatedAt());

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(llmClient).complete(messages.capture(), eq(Duration.ofMinutes(2)));
        assertThat(messages.getValue().get(1).content())
                .contains("### TRANSACTION CONTEXT:")
                .contains("### Transfers with amounts:")
                .contains("- Gas Fee: 0.000046097 ETH = $0.14 USD")
                .contains("### Resolved Signatures:\n- Function 0xa9059cbb: transfer(address,uint256)")
                .contains("### ENS Names:\n- " + ALICE + ": alice.eth");
    }

    @Test
    @DisplayName("networks endpoint served without touching collaborators")
    void networks() {
        webTestClient.get().uri("/api/v1/networks")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == 'ARBITRUM')].chainId").isEqualTo(42161);
    }

    private RawTransactionData raw() throws Exception {
        JsonNode tx = objectMapper.readTree("""
                {"hash":"%s","from":"%s","to":"%s","value":"0x0","input":"0xa9059cbb","blockNumber":"0x1312d00"}
                """.formatted(HASH, ALICE, USDC));
        JsonNode receipt = objectMapper.readTree("""
                {"from":"%s","to":"%s","status":"0x1","gasUsed":"0xb411","effectiveGasPrice":"0x3b9aca00",
                 "blockNumber":"0x1312d00"}
                """.formatted(ALICE, USDC));
        JsonNode log = objectMapper.readTree("""
                {"address":"%s","logIndex":"0x0",
                 "topics":["0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
                           "0x0000000000000000000000001111111111111111111111111111111111111111",
                           "0x0000000000000000000000002222222222222222222222222222222222222222"],
                 "data":"0x00000000000000000000000000000000000000000000000000000000004c4b40"}
                """.formatted(USDC));
        JsonNode block = objectMapper.readTree("{\"timestamp\":\"0x6553f100\"}");
        return new RawTransactionData(HASH, NetworkId.ETHEREUM, tx, receipt, block, List.of(log));
    }
}
