package com.txlens.signature;

import java.util.Optional;

/**
 * Text signatures for 4-byte function selectors and 32-byte event topics.
 */
public interface SignatureLookup {

    /**
     * @param selector 0x-prefixed 4-byte selector, e.g. {@code 0xa9059cbb}
     * @return canonical text signature such as {@code transfer(address,uint256)}, or empty when unknown
     */
    Optional<String> functionSignature(String selector);

    /**
     * @param topic 0x-prefixed 32-byte topic0
     */
    Optional<String> eventSignature(String topic);

    String sourceName();
}
