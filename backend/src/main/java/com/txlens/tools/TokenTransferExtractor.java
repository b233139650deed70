package com.txlens.tools;

import com.txlens.domain.DecodedEvent;
import com.txlens.domain.TokenTransfer;
import com.txlens.domain.TransferType;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns Transfer and TransferSingle events into {@link TokenTransfer}s. A Transfer with a {@code value} is
 * ERC-20; one with an indexed {@code tokenId} is ERC-721. Writes {@link BaggageKeys#TRANSFERS}.
 */
@Slf4j
public class TokenTransferExtractor implements Tool {

    @Override
    public String getName() {
        return ToolNames.TOKEN_TRANSFER_EXTRACTOR;
    }

    @Override
    public String getDescription() {
        return "Extracts ERC20/ERC721/ERC1155 token transfers from decoded transaction events";
    }

    @Override
    public List<String> getDependencies() {
        return List.of(ToolNames.LOG_DECODER);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        List<DecodedEvent> events = baggage.get(BaggageKeys.EVENTS).orElse(List.of());
        List<TokenTransfer> transfers = new ArrayList<>();
        for (DecodedEvent event : events) {
            toTransfer(event).ifPresent(transfers::add);
        }
        log.debug("Extracted {} transfers from {} events", transfers.size(), events.size());
        baggage.put(BaggageKeys.TRANSFERS, List.copyOf(transfers));
    }

    private static Optional<TokenTransfer> toTransfer(DecodedEvent event) {
        var params = event.parameters();
        String from = params.get("from");
        String to = params.get("to");
        if (from == null || to == null) {
            return Optional.empty();
        }
        if ("Transfer".equals(event.name())) {
            if (params.containsKey("tokenId")) {
                return Optional.of(new TokenTransfer(TransferType.ERC721, event.contract(), from, to,
                        BigInteger.ONE, new BigInteger(params.get("tokenId")), event.logIndex()));
            }
            if (params.containsKey("value")) {
                return Optional.of(new TokenTransfer(TransferType.ERC20, event.contract(), from, to,
                        new BigInteger(params.get("value")), null, event.logIndex()));
            }
        }
        if ("TransferSingle".equals(event.name()) && params.containsKey("id") && params.containsKey("value")) {
            return Optional.of(new TokenTransfer(TransferType.ERC1155, event.contract(), from, to,
                    new BigInteger(params.get("value")), new BigInteger(params.get("id")), event.logIndex()));
        }
        return Optional.empty();
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        List<TokenTransfer> transfers = baggage.get(BaggageKeys.TRANSFERS).orElse(List.of());
        if (transfers.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### Basic Token Transfers:");
        for (int i = 0; i < transfers.size(); i++) {
            TokenTransfer t = transfers.get(i);
            sb.append("\n\nTransfer #").append(i + 1).append(':')
                    .append("\n- Type: ").append(t.type())
                    .append("\n- Contract: ").append(t.contract())
                    .append("\n- From: ").append(t.from())
                    .append("\n- To: ").append(t.to());
            if (t.isFungible()) {
                sb.append("\n- Raw Amount: ").append(t.amount());
            }
            if (t.tokenId() != null) {
                sb.append("\n- Token ID: ").append(t.tokenId());
            }
        }
        return sb.toString();
    }
}
