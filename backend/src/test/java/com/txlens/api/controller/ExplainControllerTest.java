package com.txlens.api.controller;

import com.txlens.analysis.TransactionAnalyzer;
import com.txlens.analysis.UnsupportedNetworkException;
import com.txlens.api.validation.TxInputValidator;
import com.txlens.domain.ExplanationResult;
import com.txlens.domain.NetworkId;
import com.txlens.domain.TransactionRequest;
import com.txlens.domain.TransactionStatus;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import com.txlens.pipeline.ToolExecutionException;
import com.txlens.pipeline.progress.ComponentGroup;
import com.txlens.pipeline.progress.ComponentStatus;
import com.txlens.pipeline.progress.ProgressTracker;
import com.txlens.rpc.RpcException;
import com.txlens.rpc.TransactionNotFoundException;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(ExplainController.class)
@Import({TxInputValidator.class, ApiExceptionHandler.class})
class ExplainControllerTest {

    private static final String HASH = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TransactionAnalyzer transactionAnalyzer;

    @Test
    @DisplayName("explain returns the assembled result")
    void explainReturnsResult() {
        when(transactionAnalyzer.explain(new TransactionRequest(HASH, 1))).thenReturn(result());

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", " " + HASH + " ", "networkId", 1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.txHash").isEqualTo(HASH)
                .jsonPath("$.summary").isEqualTo("Alice sent 5 USDC to Bob.")
                .jsonPath("$.status").isEqualTo("SUCCESS")
                .jsonPath("$.networkName").isEqualTo("Ethereum")
                .jsonPath("$.tags[0]").isEqualTo("contract-call")
                .jsonPath("$.links.transaction").isEqualTo("https://etherscan.io/tx/" + HASH);
    }

    @Test
    @DisplayName("malformed hash rejected with INVALID_TX_HASH")
    void explainRejectsMalformedHash() {
        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", "0x1234", "networkId", 1))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TX_HASH")
                .jsonPath("$.message").isEqualTo("Invalid transaction hash format")
                .jsonPath("$.timestamp").exists();
        verifyNoInteractions(transactionAnalyzer);
    }

    @Test
    @DisplayName("unknown chain id rejected with INVALID_NETWORK")
    void explainRejectsUnknownNetwork() {
        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 5))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_NETWORK")
                .jsonPath("$.message").isEqualTo("Network ID is not supported");
    }

    @Test
    @DisplayName("unknown transaction maps to 404")
    void explainNotFound() {
        when(transactionAnalyzer.explain(any(TransactionRequest.class)))
                .thenThrow(new TransactionNotFoundException("Transaction not found: " + HASH));

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("TRANSACTION_NOT_FOUND");
    }

    @Test
    @DisplayName("tool failure maps to 502 naming the tool")
    void explainToolFailure() {
        ToolException cause = new ToolException("transaction_explainer", "LLM_UNAVAILABLE", "Language model call failed: down");
        when(transactionAnalyzer.explain(any(TransactionRequest.class)))
                .thenThrow(new ToolExecutionException("transaction_explainer", cause));

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("TOOL_FAILED")
                .jsonPath("$.message").isEqualTo("Tool transaction_explainer failed: Language model call failed: down");
    }

    @Test
    @DisplayName("RPC failure maps to 502, anything unexpected to 500")
    void explainRpcAndUnexpectedFailures() {
        when(transactionAnalyzer.explain(any(TransactionRequest.class)))
                .thenThrow(new RpcException("All RPC endpoints failed"))
                .thenThrow(new IllegalStateException("boom"));

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody().jsonPath("$.error").isEqualTo("RPC_ERROR");

        webTestClient.post().uri("/api/v1/explain")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("INTERNAL_ERROR")
                .jsonPath("$.message").isEqualTo("Unexpected server error");
    }

    @Test
    @DisplayName("stream emits component updates then the complete event")
    void explainStream() {
        ToolContext context = ToolContext.create();
        when(transactionAnalyzer.newContext()).thenReturn(context);
        doAnswer(invocation -> {
            ProgressTracker tracker = invocation.getArgument(1);
            tracker.updateComponent("fetch_data", ComponentGroup.DATA, "Fetching Transaction Data",
                    ComponentStatus.INITIATED, "Preparing to fetch...");
            tracker.updateComponent("fetch_data", ComponentGroup.DATA, "Fetching Transaction Data",
                    ComponentStatus.FINISHED, "Fetched 1 logs");
            ExplanationResult result = result();
            tracker.sendComplete(result);
            return result;
        }).when(transactionAnalyzer).explain(eq(new TransactionRequest(HASH, 1)), any(ProgressTracker.class), eq(context));

        List<ServerSentEvent<Map<String, Object>>> events = webTestClient.post().uri("/api/v1/explain/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>>() {})
                .getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(events).extracting(ServerSentEvent::event)
                .containsExactly("component_update", "component_update", "complete");
        assertThat(events.get(2).data()).containsKey("result");
        assertThat(events.get(0).data()).extractingByKey("component")
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("status", "initiated");
    }

    @Test
    @DisplayName("stream reports analysis failure as an error event")
    void explainStreamError() {
        when(transactionAnalyzer.newContext()).thenReturn(ToolContext.create());
        doAnswer(invocation -> {
            ProgressTracker tracker = invocation.getArgument(1);
            UnsupportedNetworkException failure = new UnsupportedNetworkException(1);
            tracker.sendError(failure);
            throw failure;
        }).when(transactionAnalyzer).explain(any(TransactionRequest.class), any(ProgressTracker.class), any(ToolContext.class));

        List<ServerSentEvent<Map<String, Object>>> events = webTestClient.post().uri("/api/v1/explain/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(Map.of("txHash", HASH, "networkId", 1))
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>>() {})
                .getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.event()).isEqualTo("error");
            assertThat(event.data()).containsEntry("error", "Unsupported network: 1");
        });
    }

    @Test
    @DisplayName("networks lists every supported chain")
    void networks() {
        webTestClient.get().uri("/api/v1/networks")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(NetworkId.values().length)
                .jsonPath("$[0].chainId").isEqualTo(1)
                .jsonPath("$[0].id").isEqualTo("ETHEREUM")
                .jsonPath("$[0].nativeSymbol").isEqualTo("ETH");
    }

    @Test
    @DisplayName("raw transaction endpoint validates the hash")
    void rawTransactionRejectsMalformedHash() {
        webTestClient.get().uri("/api/v1/transaction/1/0xnothex")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TX_HASH");
        verifyNoInteractions(transactionAnalyzer);
    }

    @Test
    @DisplayName("raw transaction endpoint maps unsupported chain to 400")
    void rawTransactionUnsupportedNetwork() {
        when(transactionAnalyzer.fetchRaw(5L, HASH)).thenThrow(new UnsupportedNetworkException(5));

        webTestClient.get().uri("/api/v1/transaction/5/" + HASH)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSUPPORTED_NETWORK")
                .jsonPath("$.message").isEqualTo("Unsupported network: 5");
        verify(transactionAnalyzer).fetchRaw(5L, HASH);
    }

    private static ExplanationResult result() {
        return new ExplanationResult(HASH, 1, "Ethereum", "Alice sent 5 USDC to Bob.", TransactionStatus.SUCCESS,
                "0x1111111111111111111111111111111111111111", "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",
                20_000_000L, Instant.ofEpochSecond(1_700_000_000L), List.of(), null,
                Map.of("transaction", "https://etherscan.io/tx/" + HASH), List.of("contract-call", "token-transfer"));
    }
}
