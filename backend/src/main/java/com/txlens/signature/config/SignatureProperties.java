package com.txlens.signature.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Function and event signature lookup settings, bound from {@code txlens.signatures}.
 */
@ConfigurationProperties(prefix = "txlens.signatures")
@Getter
@Setter
public class SignatureProperties {

    /**
     * When false the signature step is left out; unknown selectors and events stay unnamed.
     */
    private boolean enabled = true;

    private String baseUrl = "https://www.4byte.directory/api/v1";

    private int requestsPerMinute = 60;

    private int connectTimeoutSeconds = 10;

    private int readTimeoutSeconds = 10;
}
