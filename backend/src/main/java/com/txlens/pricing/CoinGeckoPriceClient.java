package com.txlens.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.domain.NetworkId;
import com.txlens.pricing.config.NetworkIdToCoinGeckoPlatformMapper;
import com.txlens.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Spot USD prices from CoinGecko: {@code /simple/token_price/{platform}} for contracts and
 * {@code /simple/price} for native coins. Calls share a per-minute rate limiter; any failure is logged and
 * reported as "no price".
 */
@Slf4j
public class CoinGeckoPriceClient implements TokenPriceProvider {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final String API_KEY_HEADER = "x-cg-demo-api-key";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;

    public CoinGeckoPriceClient(PricingProperties pricingProperties, WebClient.Builder webClientBuilder,
                                RateLimiter rateLimiter) {
        this.pricingProperties = pricingProperties;
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Optional<BigDecimal> tokenPriceUsd(NetworkId networkId, String contractAddress) {
        if (contractAddress == null || contractAddress.isBlank()) {
            return Optional.empty();
        }
        Optional<String> platform = NetworkIdToCoinGeckoPlatformMapper.toPlatformId(networkId);
        if (platform.isEmpty()) {
            log.debug("No CoinGecko platform for {}", networkId);
            return Optional.empty();
        }
        String contract = contractAddress.strip().toLowerCase(Locale.ROOT);
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/token_price/" + platform.get()
                + "?contract_addresses=" + contract + "&vs_currencies=usd";
        return fetch(url).flatMap(json -> parseUsdPrice(json, contract));
    }

    @Override
    public Optional<BigDecimal> nativePriceUsd(NetworkId networkId) {
        Optional<String> coinId = NetworkIdToCoinGeckoPlatformMapper.toNativeCoinId(networkId);
        if (coinId.isEmpty()) {
            return Optional.empty();
        }
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId.get() + "&vs_currencies=usd";
        return fetch(url).flatMap(json -> parseUsdPrice(json, coinId.get()));
    }

    @Override
    public String sourceName() {
        return "coingecko";
    }

    private Optional<String> fetch(String url) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("CoinGecko rate limit reached; skipping {}", url);
            return Optional.empty();
        }
        try {
            String response = webClient.get()
                    .uri(url)
                    .headers(h -> {
                        String apiKey = pricingProperties.getApiKey();
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.set(API_KEY_HEADER, apiKey);
                        }
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()));
            return Optional.ofNullable(response);
        } catch (WebClientException e) {
            log.warn("CoinGecko request failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        } catch (IllegalStateException e) {
            log.warn("CoinGecko request timed out for {}", url);
            return Optional.empty();
        }
    }

    /**
     * Reads {@code {"<id>": {"usd": <number>}}}; ids are matched case-insensitively.
     */
    static Optional<BigDecimal> parseUsdPrice(String json, String id) {
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode entry = root.path(id);
            if (entry.isMissingNode()) {
                var fields = root.fields();
                while (fields.hasNext()) {
                    var field = fields.next();
                    if (field.getKey().equalsIgnoreCase(id)) {
                        entry = field.getValue();
                        break;
                    }
                }
            }
            JsonNode usd = entry.path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
