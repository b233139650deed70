package com.txlens.analysis;

/**
 * Requested chain id has no {@link com.txlens.domain.NetworkId}.
 */
public class UnsupportedNetworkException extends RuntimeException {

    public UnsupportedNetworkException(long chainId) {
        super("Unsupported network: " + chainId);
    }
}
