package com.txlens.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Fee paid for the transaction: {@code gasUsed * effectiveGasPrice}, in native token and USD.
 *
 * @param feeUsd null when the native token price is unknown
 */
public record GasFee(BigInteger gasUsed, BigInteger effectiveGasPrice, BigDecimal feeNative, String nativeSymbol,
                     BigDecimal feeUsd) {
}
