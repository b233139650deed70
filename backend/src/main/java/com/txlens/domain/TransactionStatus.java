package com.txlens.domain;

/**
 * Execution status from the receipt: 0x1 success, 0x0 reverted.
 */
public enum TransactionStatus {
    SUCCESS,
    FAILED,
    UNKNOWN;

    public static TransactionStatus fromReceiptStatus(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.strip().toLowerCase()) {
            case "0x1", "1" -> SUCCESS;
            case "0x0", "0" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
