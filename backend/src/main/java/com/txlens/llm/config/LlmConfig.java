package com.txlens.llm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txlens.common.RetryPolicy;
import com.txlens.llm.LlmClient;
import com.txlens.llm.OpenAiLlmClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {

    @Bean
    public LlmClient llmClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        LlmProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getInitialDelayMs(), retry.getMaxDelayMs(),
                retry.getJitterFactor(), retry.getMaxAttempts());
        return new OpenAiLlmClient(properties, webClientBuilder, objectMapper, retryPolicy);
    }
}
