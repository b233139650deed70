package com.txlens.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Well-known event signatures, keyed by topic0. Parameter layout is listed in order: indexed parameters
 * come from topics 1..3, the rest from 32-byte data words.
 */
enum EventSignature {
    TRANSFER("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
            "Transfer", "Transfer(address,address,uint256)",
            List.of(indexed("from", "address"), indexed("to", "address"), data("value", "uint256"))),
    APPROVAL("0x8c5be1e5ebec7d5bd14f71427d1e84f3dd0314c0f7b2291e5b200ac8c7c3b925",
            "Approval", "Approval(address,address,uint256)",
            List.of(indexed("owner", "address"), indexed("spender", "address"), data("value", "uint256"))),
    APPROVAL_FOR_ALL("0x17307eab39ab6107e8899845ad3d59bd9653f200f220920489ca2b5937696c31",
            "ApprovalForAll", "ApprovalForAll(address,address,bool)",
            List.of(indexed("owner", "address"), indexed("operator", "address"), data("approved", "bool"))),
    TRANSFER_SINGLE("0xc3d58168c5ae7397731d063d5bbf3d657854427343f4c083240f7aacaa2d0f62",
            "TransferSingle", "TransferSingle(address,address,address,uint256,uint256)",
            List.of(indexed("operator", "address"), indexed("from", "address"), indexed("to", "address"),
                    data("id", "uint256"), data("value", "uint256"))),
    DEPOSIT("0xe1fffcc4923d04b559f4d29a8bfc6cda04eb5b0d3c460751c2402c5c5cc9109c",
            "Deposit", "Deposit(address,uint256)",
            List.of(indexed("dst", "address"), data("wad", "uint256"))),
    WITHDRAWAL("0x7fcf532c15f0a6db0bd6d0e038bea71d30d808c7d98cb3bf7268a95bf5081b65",
            "Withdrawal", "Withdrawal(address,uint256)",
            List.of(indexed("src", "address"), data("wad", "uint256"))),
    SWAP_V2("0xd78ad95fa46c994b6551d0da85fc275fe613ce37657fb8d5e3d130840159d822",
            "Swap", "Swap(address,uint256,uint256,uint256,uint256,address)",
            List.of(indexed("sender", "address"), data("amount0In", "uint256"), data("amount1In", "uint256"),
                    data("amount0Out", "uint256"), data("amount1Out", "uint256"), indexed("to", "address"))),
    SWAP_V3("0xc42079f94a6350d7e6235f29174924f928cc2ac818eb64fed8004e115fbcca67",
            "Swap", "Swap(address,address,int256,int256,uint160,uint128,int24)",
            List.of(indexed("sender", "address"), indexed("recipient", "address"), data("amount0", "int256"),
                    data("amount1", "int256"), data("sqrtPriceX96", "uint160"), data("liquidity", "uint128"),
                    data("tick", "int24")));

    private static final Map<String, EventSignature> BY_TOPIC = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(s -> s.topic0, Function.identity()));

    private final String topic0;
    private final String eventName;
    private final String canonical;
    private final List<Param> params;

    EventSignature(String topic0, String eventName, String canonical, List<Param> params) {
        this.topic0 = topic0;
        this.eventName = eventName;
        this.canonical = canonical;
        this.params = params;
    }

    static Optional<EventSignature> byTopic(String topic0) {
        return topic0 == null ? Optional.empty() : Optional.ofNullable(BY_TOPIC.get(topic0.toLowerCase(Locale.ROOT)));
    }

    String topic0() {
        return topic0;
    }

    String eventName() {
        return eventName;
    }

    String canonical() {
        return canonical;
    }

    List<Param> params() {
        return params;
    }

    long indexedCount() {
        return params.stream().filter(Param::indexed).count();
    }

    record Param(String name, String type, boolean indexed) {
    }

    private static Param indexed(String name, String type) {
        return new Param(name, type, true);
    }

    private static Param data(String name, String type) {
        return new Param(name, type, false);
    }
}
