package com.txlens.domain;

import java.util.List;
import java.util.Map;

/**
 * One receipt log decoded against a known event signature. Parameter values are strings: addresses
 * lower-cased, integers in decimal.
 *
 * @param name      event name, e.g. "Transfer"; "Unknown" when the signature is not recognized
 * @param signature canonical signature, e.g. "Transfer(address,address,uint256)"; null when unknown
 */
public record DecodedEvent(
        String contract,
        String name,
        String signature,
        Map<String, String> parameters,
        List<String> topics,
        String data,
        long logIndex
) {

    public static final String UNKNOWN = "Unknown";

    public DecodedEvent {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    public boolean isKnown() {
        return !UNKNOWN.equals(name);
    }
}
