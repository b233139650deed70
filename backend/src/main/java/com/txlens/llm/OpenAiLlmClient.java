package com.txlens.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.common.RetryPolicy;
import com.txlens.llm.config.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions against an OpenAI-compatible endpoint ({@code POST {baseUrl}/chat/completions}).
 * Retries 429, 5xx, transport errors and timeouts with exponential backoff; other failures surface at once.
 */
@Slf4j
public class OpenAiLlmClient implements LlmClient {

    private final LlmProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public OpenAiLlmClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                           RetryPolicy retryPolicy) {
        this.properties = properties;
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String complete(List<ChatMessage> messages, Duration timeout) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new LlmException("LLM API key is not configured (txlens.llm.api-key)", false);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", messages);
        body.put("temperature", properties.getTemperature());
        if (properties.getMaxTokens() > 0) {
            body.put("max_tokens", properties.getMaxTokens());
        }

        LlmException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.info("Retrying LLM call in {}ms (attempt {}/{})", delay, attempt + 1, retryPolicy.getMaxAttempts());
                sleep(delay);
            }
            long start = System.nanoTime();
            try {
                String reply = extractContent(post(body, timeout));
                log.debug("LLM call succeeded in {}ms", (System.nanoTime() - start) / 1_000_000);
                return reply;
            } catch (LlmException e) {
                last = e;
                if (!e.isRetryable()) {
                    throw e;
                }
                log.warn("LLM attempt {}/{} failed: {}", attempt + 1, retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw new LlmException("LLM call failed after " + retryPolicy.getMaxAttempts() + " attempts: "
                + last.getMessage(), false, last);
    }

    private String post(Map<String, Object> body, Duration timeout) {
        try {
            return webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new LlmException("LLM returned HTTP " + status + ": " + e.getResponseBodyAsString(),
                    status == 429 || status >= 500, e);
        } catch (WebClientRequestException e) {
            throw new LlmException("LLM request failed: " + e.getMessage(), true, e);
        } catch (IllegalStateException e) {
            throw new LlmException("LLM call timed out after " + timeout.toSeconds() + "s", true, e);
        }
    }

    private String extractContent(String json) {
        if (json == null) {
            throw new LlmException("LLM returned an empty body", true);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LlmException("LLM returned malformed JSON", false, e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new LlmException("LLM response has no message content", false);
        }
        return content.asText().strip();
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while waiting to retry", false, e);
        }
    }
}
