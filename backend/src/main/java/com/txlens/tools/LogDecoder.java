package com.txlens.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.txlens.common.EvmHex;
import com.txlens.domain.DecodedEvent;
import com.txlens.domain.RawTransactionData;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes receipt logs against the {@link EventSignature} catalogue. Unrecognized logs are kept as
 * "Unknown" events with their raw topics and data. Writes {@link BaggageKeys#EVENTS}; an empty list when the
 * receipt has no logs.
 */
@Slf4j
public class LogDecoder implements Tool {

    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    @Override
    public String getName() {
        return ToolNames.LOG_DECODER;
    }

    @Override
    public String getDescription() {
        return "Decodes transaction receipt logs into named events with parameters";
    }

    @Override
    public List<String> getDependencies() {
        return List.of();
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        Optional<RawTransactionData> raw = baggage.get(BaggageKeys.RAW_DATA);
        if (raw.isEmpty()) {
            log.debug("No raw data in baggage; nothing to decode");
            baggage.put(BaggageKeys.EVENTS, List.of());
            return;
        }
        List<DecodedEvent> events = new ArrayList<>();
        for (JsonNode logEntry : raw.get().logs()) {
            events.add(decode(logEntry));
        }
        long known = events.stream().filter(DecodedEvent::isKnown).count();
        log.debug("Decoded {} of {} logs", known, events.size());
        baggage.put(BaggageKeys.EVENTS, List.copyOf(events));
    }

    DecodedEvent decode(JsonNode logEntry) {
        String contract = logEntry.path("address").asText("").toLowerCase(Locale.ROOT);
        List<String> topics = new ArrayList<>();
        logEntry.path("topics").forEach(t -> topics.add(t.asText().toLowerCase(Locale.ROOT)));
        String data = logEntry.path("data").asText("0x");
        Long logIndex = EvmHex.toLong(logEntry.path("logIndex").asText(null));
        long index = logIndex != null ? logIndex : -1L;

        Optional<EventSignature> signature = topics.isEmpty() ? Optional.empty() : EventSignature.byTopic(topics.get(0));
        if (signature.isEmpty()) {
            return new DecodedEvent(contract, DecodedEvent.UNKNOWN, null, Map.of(), topics, data, index);
        }
        EventSignature sig = signature.get();
        if (sig == EventSignature.TRANSFER && topics.size() == 4) {
            // ERC-721: tokenId is indexed as well
            Map<String, String> params = new LinkedHashMap<>();
            putIfPresent(params, "from", EvmHex.wordToAddress(topics.get(1)));
            putIfPresent(params, "to", EvmHex.wordToAddress(topics.get(2)));
            putIfPresent(params, "tokenId", decodeValue("uint256", EvmHex.strip0x(topics.get(3))));
            return new DecodedEvent(contract, sig.eventName(), sig.canonical(), params, topics, data, index);
        }
        if (topics.size() - 1 != sig.indexedCount()) {
            return new DecodedEvent(contract, DecodedEvent.UNKNOWN, null, Map.of(), topics, data, index);
        }
        Map<String, String> params = new LinkedHashMap<>();
        int topicIndex = 1;
        int wordIndex = 0;
        for (EventSignature.Param param : sig.params()) {
            String word = param.indexed()
                    ? EvmHex.strip0x(topics.get(topicIndex++))
                    : EvmHex.word(data, wordIndex++);
            putIfPresent(params, param.name(), word == null ? null : decodeValue(param.type(), word));
        }
        return new DecodedEvent(contract, sig.eventName(), sig.canonical(), params, topics, data, index);
    }

    private static void putIfPresent(Map<String, String> params, String name, String value) {
        if (value != null) {
            params.put(name, value);
        }
    }

    static String decodeValue(String type, String word) {
        if ("address".equals(type)) {
            return EvmHex.wordToAddress(word);
        }
        if ("bool".equals(type)) {
            BigInteger v = EvmHex.toBigInteger(word);
            return v == null ? null : String.valueOf(v.signum() != 0);
        }
        BigInteger v = EvmHex.toBigInteger(word);
        if (v == null) {
            return null;
        }
        if (type.startsWith("int") && v.compareTo(INT256_MAX) > 0) {
            v = v.subtract(TWO_256);
        }
        return v.toString();
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        List<DecodedEvent> events = baggage.get(BaggageKeys.EVENTS).orElse(List.of());
        if (events.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### Events emitted:");
        for (int i = 0; i < events.size(); i++) {
            DecodedEvent event = events.get(i);
            sb.append("\n").append(i + 1).append(". ").append(event.name()).append(" on ").append(event.contract());
            event.parameters().forEach((k, v) -> sb.append("\n   - ").append(k).append(": ").append(v));
        }
        return sb.toString();
    }

    @Override
    public RagContext getRagContext(ToolContext context, Baggage baggage) {
        RagContext rag = RagContext.empty();
        baggage.get(BaggageKeys.EVENTS).orElse(List.of()).stream()
                .filter(DecodedEvent::isKnown)
                .map(DecodedEvent::signature)
                .distinct()
                .forEach(signature -> rag.addItem(new RagContextItem(
                        "event:" + signature, "event", "Event " + signature,
                        "The transaction emitted " + signature + " events.",
                        Map.of("signature", signature), List.of(signature.substring(0, signature.indexOf('('))), 0.5)));
        return rag;
    }
}
