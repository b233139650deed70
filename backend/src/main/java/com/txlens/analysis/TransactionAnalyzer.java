package com.txlens.analysis;

import com.txlens.domain.DecodedEvent;
import com.txlens.domain.EnrichedTransfer;
import com.txlens.domain.ExplanationResult;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TokenTransfer;
import com.txlens.domain.TransactionContext;
import com.txlens.domain.TransactionRequest;
import com.txlens.domain.TransactionStatus;
import com.txlens.domain.TransferType;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.BaggagePipeline;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.progress.ComponentGroup;
import com.txlens.pipeline.progress.ComponentStatus;
import com.txlens.pipeline.progress.ProgressTracker;
import com.txlens.rpc.TransactionDataFetcher;
import com.txlens.tools.BaggageKeys;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Explains one transaction end to end: fetches the raw data, runs a fresh tool pipeline over it and
 * assembles the {@link ExplanationResult} from the final baggage.
 */
@Slf4j
public class TransactionAnalyzer {

    public static final String FETCH_COMPONENT = "fetch_data";

    private final TransactionDataFetcher fetcher;
    private final ToolPipelineFactory pipelineFactory;
    private final Duration runTimeout;

    public TransactionAnalyzer(TransactionDataFetcher fetcher, ToolPipelineFactory pipelineFactory, Duration runTimeout) {
        this.fetcher = fetcher;
        this.pipelineFactory = pipelineFactory;
        this.runTimeout = runTimeout;
    }

    public ExplanationResult explain(TransactionRequest request) {
        return explain(request, null, ToolContext.withTimeout(runTimeout));
    }

    /**
     * Runs the analysis and reports every step to {@code tracker}, ending with a complete or error event.
     *
     * @param tracker may be null
     * @param context cancellation signal; cancel it to stop the run between tools
     * @throws UnsupportedNetworkException unknown chain id
     * @throws com.txlens.rpc.TransactionNotFoundException the hash is unknown or still pending
     * @throws com.txlens.pipeline.ToolExecutionException a tool failed
     */
    public ExplanationResult explain(TransactionRequest request, ProgressTracker tracker, ToolContext context) {
        try {
            ExplanationResult result = run(request, tracker, context);
            if (tracker != null) {
                tracker.sendComplete(result);
            }
            return result;
        } catch (RuntimeException e) {
            if (tracker != null) {
                tracker.sendError(e);
            }
            throw e;
        }
    }

    public ToolContext newContext() {
        return ToolContext.withTimeout(runTimeout);
    }

    /** Raw RPC data for a transaction without running any tool. */
    public RawTransactionData fetchRaw(long chainId, String txHash) {
        return fetcher.fetch(resolveNetwork(chainId), normalizeHash(txHash));
    }

    private ExplanationResult run(TransactionRequest request, ProgressTracker tracker, ToolContext context) {
        NetworkId networkId = resolveNetwork(request.networkId());
        String txHash = normalizeHash(request.txHash());
        log.info("Explaining {} on {}", txHash, networkId);

        RawTransactionData raw = fetch(networkId, txHash, tracker);

        Baggage baggage = new Baggage();
        baggage.put(BaggageKeys.RAW_DATA, raw);
        BaggagePipeline pipeline = pipelineFactory.create(tracker);
        pipeline.execute(context, baggage);

        return assemble(networkId, txHash, baggage);
    }

    private RawTransactionData fetch(NetworkId networkId, String txHash, ProgressTracker tracker) {
        report(tracker, ComponentStatus.INITIATED, "Preparing to fetch...");
        report(tracker, ComponentStatus.RUNNING, "Fetching transaction, receipt and block from " + networkId.getDisplayName());
        try {
            RawTransactionData raw = fetcher.fetch(networkId, txHash);
            report(tracker, ComponentStatus.FINISHED, "Fetched " + raw.logs().size() + " logs");
            return raw;
        } catch (RuntimeException e) {
            report(tracker, ComponentStatus.ERROR, "Failed: " + e.getMessage());
            throw e;
        }
    }

    private static void report(ProgressTracker tracker, ComponentStatus status, String description) {
        if (tracker != null) {
            tracker.updateComponent(FETCH_COMPONENT, ComponentGroup.DATA, "Fetching Transaction Data", status, description);
        }
    }

    static ExplanationResult assemble(NetworkId networkId, String txHash, Baggage baggage) {
        TransactionContext tx = baggage.get(BaggageKeys.TRANSACTION_CONTEXT).orElse(null);
        List<EnrichedTransfer> transfers = baggage.get(BaggageKeys.ENRICHED_TRANSFERS)
                .orElseGet(() -> baggage.get(BaggageKeys.TRANSFERS).orElse(List.<TokenTransfer>of()).stream()
                        .map(EnrichedTransfer::unpriced)
                        .toList());
        List<DecodedEvent> events = baggage.get(BaggageKeys.EVENTS).orElse(List.of());

        return new ExplanationResult(
                txHash,
                networkId.getChainId(),
                networkId.getDisplayName(),
                baggage.get(BaggageKeys.EXPLANATION).orElse(""),
                tx != null ? tx.status() : TransactionStatus.UNKNOWN,
                tx != null ? tx.sender() : null,
                tx != null ? tx.recipient() : null,
                tx != null ? tx.blockNumber() : null,
                tx != null ? tx.timestamp() : null,
                transfers,
                baggage.get(BaggageKeys.GAS_FEE).orElse(null),
                links(networkId, txHash, tx),
                tags(tx, transfers, events));
    }

    static Map<String, String> links(NetworkId networkId, String txHash, TransactionContext tx) {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("transaction", networkId.transactionUrl(txHash));
        if (tx != null && tx.sender() != null) {
            links.put("sender", networkId.addressUrl(tx.sender()));
        }
        if (tx != null && tx.recipient() != null) {
            links.put("recipient", networkId.addressUrl(tx.recipient()));
        }
        return links;
    }

    static List<String> tags(TransactionContext tx, List<EnrichedTransfer> transfers, List<DecodedEvent> events) {
        Set<String> tags = new LinkedHashSet<>();
        if (tx != null && tx.status() == TransactionStatus.FAILED) {
            tags.add("failed");
        }
        if (tx != null && tx.isContractCall()) {
            tags.add("contract-call");
        } else if (tx != null) {
            tags.add("native-transfer");
        }
        for (EnrichedTransfer t : transfers) {
            tags.add(t.type() == TransferType.ERC20 ? "token-transfer" : "nft-transfer");
        }
        for (DecodedEvent event : events) {
            switch (event.name()) {
                case "Swap" -> tags.add("swap");
                case "Approval", "ApprovalForAll" -> tags.add("approval");
                case "Deposit", "Withdrawal" -> tags.add("wrap");
                default -> { }
            }
        }
        return new ArrayList<>(tags);
    }

    private static NetworkId resolveNetwork(long chainId) {
        return NetworkId.fromChainId(chainId).orElseThrow(() -> new UnsupportedNetworkException(chainId));
    }

    private static String normalizeHash(String txHash) {
        return txHash == null ? null : txHash.trim().toLowerCase(Locale.ROOT);
    }
}
