package com.txlens.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.txlens.cache.CacheKeys;
import com.txlens.cache.CacheTtl;
import com.txlens.cache.ToolCache;
import com.txlens.common.EvmHex;
import com.txlens.common.Keccak256;
import com.txlens.domain.NetworkId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Primary ENS name of an address through the mainnet registry: reverse record {@code <addr>.addr.reverse},
 * then a forward lookup of the returned name that must point back to the same address.
 * <p>
 * Verified names and confirmed absences are cached for {@link CacheTtl#ENS}; RPC failures are not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class EnsReverseResolver {

    static final String REGISTRY = "0x00000000000c2e074ec69a0dfb2997ba6c7d2e1e";
    /** resolver(bytes32) */
    static final String RESOLVER_SELECTOR = "0x0178b8bf";
    /** name(bytes32) */
    static final String NAME_SELECTOR = "0x691f3431";
    /** addr(bytes32) */
    static final String ADDR_SELECTOR = "0x3b3b57de";

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final String NO_NAME = "";

    private final EvmRpcGateway gateway;
    private final ToolCache cache;

    public Optional<String> reverseName(String address) {
        if (address == null) {
            return Optional.empty();
        }
        String addr = address.strip().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(addr).matches() || ZERO_ADDRESS.equals(addr)) {
            return Optional.empty();
        }
        String cacheKey = CacheKeys.ensName(addr);
        Optional<String> cached = cache.getJson(cacheKey, String.class);
        if (cached.isPresent()) {
            return cached.filter(name -> !name.isEmpty());
        }

        String name;
        try {
            name = lookup(addr);
        } catch (RpcException e) {
            log.debug("ENS lookup for {} failed: {}", addr, e.getMessage());
            return Optional.empty();
        }
        cache.setJson(cacheKey, name, CacheTtl.ENS);
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    private String lookup(String addr) {
        String reverseNode = namehash(addr.substring(2) + ".addr.reverse");
        String reverseResolver = resolverOf(reverseNode);
        if (reverseResolver == null) {
            return NO_NAME;
        }
        String name = call(reverseResolver, NAME_SELECTOR, reverseNode).map(EvmHex::decodeAbiString).orElse("");
        if (name.isBlank()) {
            return NO_NAME;
        }

        String forwardNode = namehash(name);
        String forwardResolver = resolverOf(forwardNode);
        String resolved = forwardResolver == null ? null
                : call(forwardResolver, ADDR_SELECTOR, forwardNode).map(hex -> EvmHex.wordToAddress(EvmHex.word(hex, 0)))
                        .orElse(null);
        if (!addr.equals(resolved)) {
            log.debug("Reverse record {} of {} resolves to {}; ignored", name, addr, resolved);
            return NO_NAME;
        }
        return name;
    }

    private String resolverOf(String node) {
        String resolver = call(REGISTRY, RESOLVER_SELECTOR, node)
                .map(hex -> EvmHex.wordToAddress(EvmHex.word(hex, 0)))
                .orElse(null);
        return resolver == null || ZERO_ADDRESS.equals(resolver) ? null : resolver;
    }

    private Optional<String> call(String to, String selector, String node) {
        List<Object> params = List.of(Map.of("to", to, "data", selector + EvmHex.strip0x(node)), "latest");
        JsonNode result = gateway.call(NetworkId.ETHEREUM, "eth_call", params);
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x") || hex.length() < 66) {
            return Optional.empty();
        }
        return Optional.of(hex);
    }

    /**
     * EIP-137 namehash of a dot-separated name; labels are lower-cased, no further normalization.
     */
    public static String namehash(String name) {
        byte[] node = new byte[32];
        if (name == null || name.isBlank()) {
            return Keccak256.toHex(node);
        }
        String[] labels = name.strip().toLowerCase(Locale.ROOT).split("\\.");
        for (int i = labels.length - 1; i >= 0; i--) {
            byte[] labelHash = Keccak256.hash(labels[i].getBytes(StandardCharsets.UTF_8));
            byte[] combined = new byte[64];
            System.arraycopy(node, 0, combined, 0, 32);
            System.arraycopy(labelHash, 0, combined, 32, 32);
            node = Keccak256.hash(combined);
        }
        return Keccak256.toHex(node);
    }
}
