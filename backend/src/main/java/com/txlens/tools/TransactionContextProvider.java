package com.txlens.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.txlens.common.EvmHex;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TransactionContext;
import com.txlens.domain.TransactionStatus;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts sender, recipient, value, gas and status from the raw transaction, receipt and block.
 * Writes {@link BaggageKeys#TRANSACTION_CONTEXT}.
 */
@Slf4j
public class TransactionContextProvider implements Tool {

    @Override
    public String getName() {
        return ToolNames.TRANSACTION_CONTEXT_PROVIDER;
    }

    @Override
    public String getDescription() {
        return "Provides basic transaction metadata context (sender, recipient, gas, status)";
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        RawTransactionData raw = baggage.get(BaggageKeys.RAW_DATA)
                .orElseThrow(() -> new ToolException(getName(), "MISSING_INPUT", "No raw transaction data in baggage"));
        JsonNode tx = raw.transaction();
        JsonNode receipt = raw.receipt();

        String sender = lower(firstText(receipt, tx, "from"));
        String recipient = lower(firstText(receipt, tx, "to"));
        String input = text(tx, "input");
        String selector = input != null && input.length() >= 10 ? input.substring(0, 10).toLowerCase(Locale.ROOT) : null;
        Long blockNumber = EvmHex.toLong(firstText(receipt, tx, "blockNumber"));
        Long blockTime = EvmHex.toLong(text(raw.block(), "timestamp"));
        BigInteger gasPrice = EvmHex.toBigInteger(text(receipt, "effectiveGasPrice"));
        if (gasPrice == null) {
            gasPrice = EvmHex.toBigInteger(text(tx, "gasPrice"));
        }

        TransactionContext txContext = new TransactionContext(
                raw.txHash(),
                raw.networkId(),
                sender,
                recipient,
                Optional.ofNullable(EvmHex.toBigInteger(text(tx, "value"))).orElse(BigInteger.ZERO),
                EvmHex.toBigInteger(text(receipt, "gasUsed")),
                gasPrice,
                TransactionStatus.fromReceiptStatus(text(receipt, "status")),
                blockNumber,
                blockTime != null ? Instant.ofEpochSecond(blockTime) : null,
                selector);
        baggage.put(BaggageKeys.TRANSACTION_CONTEXT, txContext);
        log.debug("Transaction context for {}: status {}, sender {}", raw.txHash(), txContext.status(), sender);
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        Optional<TransactionContext> found = baggage.get(BaggageKeys.TRANSACTION_CONTEXT);
        if (found.isEmpty()) {
            return "";
        }
        TransactionContext tx = found.get();
        StringBuilder sb = new StringBuilder("### TRANSACTION CONTEXT:");
        sb.append("\n- Network: ").append(tx.networkId().getDisplayName());
        if (tx.sender() != null) {
            sb.append("\n- TRANSACTION SENDER: ").append(tx.sender()).append(" (the address that initiated this transaction)");
        }
        if (tx.recipient() != null) {
            sb.append(tx.isContractCall() ? "\n- Contract Called: " : "\n- Recipient: ").append(tx.recipient());
        }
        if (tx.methodSelector() != null) {
            sb.append("\n- Method Selector: ").append(tx.methodSelector());
        }
        if (tx.valueWei() != null && tx.valueWei().signum() > 0) {
            sb.append("\n- Native Value Sent: ").append(EvmHex.scale(tx.valueWei(), 18).toPlainString())
                    .append(' ').append(tx.networkId().getNativeSymbol());
        }
        if (tx.gasUsed() != null) {
            sb.append("\n- Total Gas Used: ").append(tx.gasUsed());
        }
        sb.append("\n- Status: ").append(formatStatus(tx.status()));
        if (tx.timestamp() != null) {
            sb.append("\n- Timestamp: ").append(tx.timestamp());
        }
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        baggage.get(BaggageKeys.TRANSACTION_CONTEXT).ifPresent(tx -> {
            if (tx.sender() != null) {
                rag.addItem(new RagContextItem("address:" + tx.sender(), "address", "Transaction sender",
                        tx.sender() + " initiated the transaction on " + tx.networkId().getDisplayName() + ".",
                        Map.of("role", "sender"), List.of("sender", tx.sender()), 0.9));
            }
            if (tx.recipient() != null) {
                rag.addItem(new RagContextItem("address:" + tx.recipient(), "address", "Transaction target",
                        tx.recipient() + (tx.isContractCall() ? " is the contract that was called." : " received the transaction."),
                        Map.of("role", "recipient"), List.of("recipient", tx.recipient()), 0.8));
            }
        });
        return rag;
    }

    private static String formatStatus(TransactionStatus status) {
        return switch (status) {
            case SUCCESS -> "Success";
            case FAILED -> "Failed";
            case UNKNOWN -> "Unknown";
        };
    }

    private static String firstText(JsonNode primary, JsonNode fallback, String field) {
        String value = text(primary, field);
        return value != null ? value : text(fallback, field);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
