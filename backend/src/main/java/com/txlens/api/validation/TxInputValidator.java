package com.txlens.api.validation;

import com.txlens.domain.NetworkId;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates transaction hash and chain id for the explain endpoints.
 */
@Component
public class TxInputValidator {

    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public boolean isValidTxHash(String txHash) {
        if (txHash == null || txHash.isBlank()) return false;
        return TX_HASH.matcher(txHash.trim()).matches();
    }

    /** Null is rejected; any chain id with a {@link NetworkId} is accepted. */
    public boolean isSupportedNetwork(Long chainId) {
        return chainId != null && NetworkId.fromChainId(chainId).isPresent();
    }
}
