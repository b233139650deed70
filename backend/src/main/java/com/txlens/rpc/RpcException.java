package com.txlens.rpc;

import lombok.Getter;

/**
 * Thrown when a JSON-RPC call fails at HTTP level, returns an error object, or exhausts its retries.
 * {@code httpStatus} is 0 when no HTTP response was received; {@code rpcCode} is null unless the node
 * returned a JSON-RPC error.
 */
@Getter
public class RpcException extends RuntimeException {

    private final int httpStatus;
    private final Integer rpcCode;

    public RpcException(String message) {
        this(message, 0, null, null);
    }

    public RpcException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public RpcException(String message, int httpStatus, Integer rpcCode, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.rpcCode = rpcCode;
    }

    /** Rate limits, upstream 5xx and transport failures are worth another endpoint or another try. */
    public boolean isRetryable() {
        if (httpStatus == 429 || httpStatus >= 500) {
            return true;
        }
        if (rpcCode != null) {
            // -32005 limit exceeded, -32603 internal error
            return rpcCode == -32005 || rpcCode == -32603;
        }
        return httpStatus == 0;
    }
}
