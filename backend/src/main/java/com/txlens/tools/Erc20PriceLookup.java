package com.txlens.tools;

import com.txlens.cache.CacheKeys;
import com.txlens.cache.CacheTtl;
import com.txlens.cache.ToolCache;
import com.txlens.domain.NetworkId;
import com.txlens.domain.RawTransactionData;
import com.txlens.domain.TokenMetadata;
import com.txlens.domain.TokenPrice;
import com.txlens.domain.TokenTransfer;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import com.txlens.pricing.TokenPriceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up spot USD prices for every fungible token moved in the transaction and for the network's gas
 * token. Prices are cached for an hour. Writes {@link BaggageKeys#TOKEN_PRICES} (tokens without a price are
 * left out) and {@link BaggageKeys#NATIVE_TOKEN_PRICE} when the gas token price is known.
 */
@Slf4j
@RequiredArgsConstructor
public class Erc20PriceLookup implements Tool {

    private final TokenPriceProvider priceProvider;
    private final ToolCache cache;

    @Override
    public String getName() {
        return ToolNames.ERC20_PRICE_LOOKUP;
    }

    @Override
    public String getDescription() {
        return "Looks up current USD prices for transferred ERC20 tokens and the native gas token";
    }

    @Override
    public List<String> getDependencies() {
        return List.of(ToolNames.TOKEN_METADATA_ENRICHER);
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        RawTransactionData raw = baggage.get(BaggageKeys.RAW_DATA)
                .orElseThrow(() -> new ToolException(getName(), "MISSING_INPUT", "No raw transaction data in baggage"));
        NetworkId networkId = raw.networkId();
        Map<String, TokenMetadata> metadata = baggage.get(BaggageKeys.TOKEN_METADATA).orElse(Map.of());

        Set<String> tokens = new LinkedHashSet<>();
        baggage.get(BaggageKeys.TRANSFERS).orElse(List.<TokenTransfer>of()).stream()
                .filter(TokenTransfer::isFungible)
                .forEach(t -> tokens.add(t.contract()));

        Map<String, TokenPrice> prices = new LinkedHashMap<>();
        for (String token : tokens) {
            context.throwIfCancelled();
            TokenMetadata meta = metadata.get(token);
            String symbol = meta != null ? meta.symbol() : null;
            tokenPrice(networkId, token, symbol).ifPresent(price -> prices.put(token, price));
        }
        baggage.put(BaggageKeys.TOKEN_PRICES, Collections.unmodifiableMap(prices));

        context.throwIfCancelled();
        nativePrice(networkId).ifPresent(price -> baggage.put(BaggageKeys.NATIVE_TOKEN_PRICE, price));
        log.debug("Priced {}/{} tokens on {}", prices.size(), tokens.size(), networkId);
    }

    private Optional<TokenPrice> tokenPrice(NetworkId networkId, String token, String symbol) {
        String key = CacheKeys.erc20Price(networkId.getChainId(), token);
        Optional<TokenPrice> cached = cache.getJson(key, TokenPrice.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<TokenPrice> fetched = priceProvider.tokenPriceUsd(networkId, token)
                .map(usd -> new TokenPrice(token, symbol, usd, priceProvider.sourceName(), Instant.now()));
        fetched.ifPresent(price -> cache.setJson(key, price, CacheTtl.PRICE));
        return fetched;
    }

    private Optional<BigDecimal> nativePrice(NetworkId networkId) {
        String key = CacheKeys.nativePrice(networkId.getChainId());
        Optional<BigDecimal> cached = cache.getJson(key, BigDecimal.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<BigDecimal> fetched = priceProvider.nativePriceUsd(networkId);
        fetched.ifPresent(price -> cache.setJson(key, price, CacheTtl.PRICE));
        return fetched;
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        Map<String, TokenPrice> prices = baggage.get(BaggageKeys.TOKEN_PRICES).orElse(Map.of());
        Optional<BigDecimal> nativePrice = baggage.get(BaggageKeys.NATIVE_TOKEN_PRICE);
        if (prices.isEmpty() && nativePrice.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("### Token Prices (USD):");
        prices.values().forEach(p -> sb.append("\n- ")
                .append(p.symbol() != null && !p.symbol().isBlank() ? p.symbol() : p.tokenAddress())
                .append(": $").append(p.priceUsd().stripTrailingZeros().toPlainString()));
        nativePrice.ifPresent(p -> sb.append("\n- Native gas token: $").append(p.stripTrailingZeros().toPlainString()));
        return sb.toString();
    }
}
