package com.txlens.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TxInputValidatorTest {

    private final TxInputValidator validator = new TxInputValidator();

    @Test
    @DisplayName("Valid transaction hash accepted, surrounding whitespace ignored")
    void validTxHash() {
        assertThat(validator.isValidTxHash("0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060")).isTrue();
        assertThat(validator.isValidTxHash(" 0x5C504ED432CB51138BCF09AA5E8A410DD4A1E204EF84BFED1BE16DFBA1B22060 ")).isTrue();
    }

    @Test
    @DisplayName("Invalid transaction hash rejected")
    void invalidTxHash() {
        assertThat(validator.isValidTxHash(null)).isFalse();
        assertThat(validator.isValidTxHash("")).isFalse();
        assertThat(validator.isValidTxHash("0x123")).isFalse();
        assertThat(validator.isValidTxHash("5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060")).isFalse();
        assertThat(validator.isValidTxHash("0x" + "g".repeat(64))).isFalse();
        assertThat(validator.isValidTxHash("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
    }

    @Test
    @DisplayName("Known chain ids accepted, unknown and null rejected")
    void supportedNetworks() {
        assertThat(validator.isSupportedNetwork(1L)).isTrue();
        assertThat(validator.isSupportedNetwork(42161L)).isTrue();
        assertThat(validator.isSupportedNetwork(5L)).isFalse();
        assertThat(validator.isSupportedNetwork(null)).isFalse();
    }
}
