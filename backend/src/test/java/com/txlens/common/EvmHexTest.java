package com.txlens.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EvmHexTest {

    private static final String USDC_STRING =
            "0x0000000000000000000000000000000000000000000000000000000000000020"
                    + "0000000000000000000000000000000000000000000000000000000000000004"
                    + "5553444300000000000000000000000000000000000000000000000000000000";

    /** MKR returns its symbol as bytes32. */
    private static final String MKR_BYTES32 = "0x4d4b520000000000000000000000000000000000000000000000000000000000";

    @Test
    void toBigInteger_parsesQuantities() {
        assertThat(EvmHex.toBigInteger("0x1a")).isEqualTo(BigInteger.valueOf(26));
        assertThat(EvmHex.toBigInteger("0x")).isNull();
        assertThat(EvmHex.toBigInteger("0xzz")).isNull();
        assertThat(EvmHex.toBigInteger(null)).isNull();
        assertThat(EvmHex.toLong("0x12d687")).isEqualTo(1234567L);
    }

    @Test
    void wordToAddress_takesLast20BytesLowerCase() {
        assertThat(EvmHex.wordToAddress("0x000000000000000000000000A0B86991C6218B36C1D19D4A2E9EB0CE3606EB48"))
                .isEqualTo("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
        assertThat(EvmHex.wordToAddress("0x1234")).isNull();
    }

    @Test
    void word_returnsNthWordOrNull() {
        String data = "0x" + "0".repeat(63) + "1" + "0".repeat(63) + "2";
        assertThat(EvmHex.word(data, 1)).endsWith("2").hasSize(64);
        assertThat(EvmHex.word(data, 2)).isNull();
    }

    @Test
    void decodeAbiString_dynamicAndBytes32() {
        assertThat(EvmHex.decodeAbiString(USDC_STRING)).isEqualTo("USDC");
        assertThat(EvmHex.decodeAbiString(MKR_BYTES32)).isEqualTo("MKR");
        assertThat(EvmHex.decodeAbiString("0x")).isEmpty();
    }

    @Test
    void scale_movesDecimalPointAndStripsZeros() {
        assertThat(EvmHex.scale(new BigInteger("1500000"), 6)).isEqualTo(new BigDecimal("1.5"));
        assertThat(EvmHex.scale(new BigInteger("2000000000000000000"), 18)).isEqualTo(new BigDecimal("2"));
        assertThat(EvmHex.scale(BigInteger.valueOf(7), 0)).isEqualTo(new BigDecimal("7"));
        assertThat(EvmHex.scale(null, 18)).isNull();
    }
}
