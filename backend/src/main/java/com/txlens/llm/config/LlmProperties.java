package com.txlens.llm.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Language model settings. Documented in application.yml under txlens.llm.
 */
@ConfigurationProperties(prefix = "txlens.llm")
@NoArgsConstructor
@Getter
@Setter
public class LlmProperties {

    /** OpenAI-compatible API base URL. */
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "gpt-4o-mini";

    private double temperature = 0.1;

    /** 0 leaves the limit to the provider. */
    private int maxTokens = 0;

    /** Timeout per attempt. */
    private Duration timeout = Duration.ofMinutes(2);

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Total attempts, the first included. */
        private int maxAttempts = 3;

        private long initialDelayMs = 1_000L;

        private long maxDelayMs = 30_000L;

        private double jitterFactor = 0.2;
    }
}
