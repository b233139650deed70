package com.txlens.rpc;

/**
 * The node does not know the transaction, or it has no receipt yet.
 */
public class TransactionNotFoundException extends RuntimeException {

    public TransactionNotFoundException(String message) {
        super(message);
    }
}
