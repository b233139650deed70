package com.txlens.api.controller;

import com.txlens.analysis.TransactionAnalyzer;
import com.txlens.api.dto.ExplainRequest;
import com.txlens.api.dto.NetworkResponse;
import com.txlens.api.validation.TxInputValidator;
import com.txlens.domain.ExplanationResult;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.progress.ProgressEvent;
import com.txlens.pipeline.progress.ProgressTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.List;

/**
 * Transaction explanation API. Analysis blocks on RPC and model calls, so it runs on the bounded elastic
 * scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ExplainController {

    private final TransactionAnalyzer transactionAnalyzer;
    private final TxInputValidator txInputValidator;

    @PostMapping("/explain")
    public Mono<ExplanationResult> explain(@Valid @RequestBody ExplainRequest request) {
        return Mono.fromCallable(() -> transactionAnalyzer.explain(request.toTransactionRequest()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Streams component updates while the analysis runs, then one {@code complete} event carrying the result
     * or one {@code error} event. Closing the stream cancels the run before its next tool.
     */
    @PostMapping(value = "/explain/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> explainStream(@Valid @RequestBody ExplainRequest request) {
        return Flux.<ProgressEvent>create(sink -> {
                    ToolContext context = transactionAnalyzer.newContext();
                    ProgressTracker tracker = new ProgressTracker(sink::next);
                    sink.onCancel(context::cancel);
                    Schedulers.boundedElastic().schedule(() -> {
                        try {
                            transactionAnalyzer.explain(request.toTransactionRequest(), tracker, context);
                        } catch (RuntimeException e) {
                            log.warn("Streamed explanation of {} failed: {}", request.txHash(), e.getMessage());
                        } finally {
                            sink.complete();
                        }
                    });
                })
                .map(event -> ServerSentEvent.builder(event).event(event.type()).build());
    }

    @GetMapping("/networks")
    public List<NetworkResponse> networks() {
        return Arrays.stream(NetworkId.values()).map(NetworkResponse::from).toList();
    }

    @GetMapping("/transaction/{networkId}/{txHash}")
    public Mono<RawTransactionData> transaction(@PathVariable long networkId, @PathVariable String txHash) {
        if (!txInputValidator.isValidTxHash(txHash)) {
            return Mono.error(new InvalidRequestException("INVALID_TX_HASH", "Invalid transaction hash format"));
        }
        return Mono.fromCallable(() -> transactionAnalyzer.fetchRaw(networkId, txHash))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
