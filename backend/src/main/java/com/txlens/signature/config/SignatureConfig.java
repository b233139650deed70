package com.txlens.signature.config;

import com.txlens.signature.FourByteSignatureClient;
import com.txlens.signature.SignatureLookup;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(SignatureProperties.class)
public class SignatureConfig {

    @Bean(name = "fourByteRateLimiter")
    public RateLimiter fourByteRateLimiter(SignatureProperties signatureProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, signatureProperties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofSeconds(signatureProperties.getConnectTimeoutSeconds()))
                .build();
        return RateLimiter.of("fourbyte", config);
    }

    @Bean
    public SignatureLookup signatureLookup(SignatureProperties signatureProperties, WebClient.Builder webClientBuilder,
                                           @Qualifier("fourByteRateLimiter") RateLimiter fourByteRateLimiter) {
        return new FourByteSignatureClient(signatureProperties, webClientBuilder, fourByteRateLimiter);
    }
}
