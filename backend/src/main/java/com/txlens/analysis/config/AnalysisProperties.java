package com.txlens.analysis.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Analysis run settings. Documented in application.yml under txlens.analysis.
 */
@ConfigurationProperties(prefix = "txlens.analysis")
@NoArgsConstructor
@Getter
@Setter
public class AnalysisProperties {

    /** Deadline for one pipeline run; tools stop between blocking calls once it passes. */
    private Duration timeout = Duration.ofMinutes(3);
}
