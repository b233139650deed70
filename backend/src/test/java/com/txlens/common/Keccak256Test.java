package com.txlens.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class Keccak256Test {

    @Test
    void emptyInput() {
        assertThat(Keccak256.toHex(Keccak256.hash(new byte[0])))
                .isEqualTo("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
    }

    @Test
    @DisplayName("event topics and function selectors match their published values")
    void eventTopicsAndSelectors() {
        assertThat(Keccak256.hashHex("Transfer(address,address,uint256)"))
                .isEqualTo("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef");
        assertThat(Keccak256.hashHex("transfer(address,uint256)")).startsWith("0xa9059cbb");
        assertThat(Keccak256.hashHex("decimals()")).startsWith("0x313ce567");
        assertThat(Keccak256.hashHex("resolver(bytes32)")).startsWith("0x0178b8bf");
    }

    @Test
    void inputsAroundTheBlockBoundaryHashDifferently() {
        byte[] oneShort = "a".repeat(135).getBytes(StandardCharsets.UTF_8);
        byte[] fullBlock = "a".repeat(136).getBytes(StandardCharsets.UTF_8);

        assertThat(Keccak256.hash(oneShort)).hasSize(32);
        assertThat(Keccak256.hash(fullBlock)).hasSize(32).isNotEqualTo(Keccak256.hash(oneShort));
        assertThat(Keccak256.hash(fullBlock)).isEqualTo(Keccak256.hash(fullBlock.clone()));
    }
}
