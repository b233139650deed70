package com.txlens.signature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.signature.config.SignatureProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Signature lookup against the 4byte.directory API. Several text signatures can share a selector; the one
 * registered first (lowest id) is taken, which is the common one in practice. Failures are logged and
 * reported as "unknown".
 */
@Slf4j
public class FourByteSignatureClient implements SignatureLookup {

    private static final Pattern SELECTOR = Pattern.compile("^0x[0-9a-f]{8}$");
    private static final Pattern TOPIC = Pattern.compile("^0x[0-9a-f]{64}$");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SignatureProperties signatureProperties;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;

    public FourByteSignatureClient(SignatureProperties signatureProperties, WebClient.Builder webClientBuilder,
                                   RateLimiter rateLimiter) {
        this.signatureProperties = signatureProperties;
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Optional<String> functionSignature(String selector) {
        String hex = normalize(selector);
        if (!SELECTOR.matcher(hex).matches()) {
            return Optional.empty();
        }
        return fetch(signatureProperties.getBaseUrl() + "/signatures/?hex_signature=" + hex)
                .flatMap(FourByteSignatureClient::parseFirstSignature);
    }

    @Override
    public Optional<String> eventSignature(String topic) {
        String hex = normalize(topic);
        if (!TOPIC.matcher(hex).matches()) {
            return Optional.empty();
        }
        return fetch(signatureProperties.getBaseUrl() + "/event-signatures/?hex_signature=" + hex)
                .flatMap(FourByteSignatureClient::parseFirstSignature);
    }

    @Override
    public String sourceName() {
        return "4byte";
    }

    private Optional<String> fetch(String url) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("4byte rate limit reached; skipping {}", url);
            return Optional.empty();
        }
        try {
            String response = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(signatureProperties.getReadTimeoutSeconds()));
            return Optional.ofNullable(response);
        } catch (WebClientException e) {
            log.warn("4byte request failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        } catch (IllegalStateException e) {
            log.warn("4byte request timed out for {}", url);
            return Optional.empty();
        }
    }

    /**
     * Reads {@code {"results": [{"id": 1, "text_signature": "..."}]}} and returns the entry with the lowest id.
     */
    static Optional<String> parseFirstSignature(String json) {
        try {
            JsonNode results = MAPPER.readTree(json).path("results");
            String best = null;
            long bestId = Long.MAX_VALUE;
            for (JsonNode entry : results) {
                String text = entry.path("text_signature").asText("");
                long id = entry.path("id").asLong(Long.MAX_VALUE);
                if (!text.isBlank() && (best == null || id < bestId)) {
                    best = text;
                    bestId = id;
                }
            }
            return Optional.ofNullable(best);
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String normalize(String hex) {
        return hex == null ? "" : hex.strip().toLowerCase(Locale.ROOT);
    }
}
