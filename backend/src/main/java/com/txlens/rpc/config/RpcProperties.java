package com.txlens.rpc.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-network RPC endpoints, retry policy and throttling. Documented in application.yml under txlens.rpc.
 * A network without configured URLs uses its public default endpoint.
 */
@ConfigurationProperties(prefix = "txlens.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** Key: NetworkId name (e.g. ETHEREUM, ARBITRUM). */
    private Map<String, NetworkEntry> network = new HashMap<>();

    private Retry retry = new Retry();

    /** Global RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 25;

    /** How long a call may wait for a local rate-limit permit before failing. */
    private long limiterTimeoutMs = 2_000;

    /** Timeout for one JSON-RPC call. */
    private Duration callTimeout = Duration.ofSeconds(20);

    /** Time to skip an endpoint after it answered HTTP 429. */
    private Duration rateLimitCooldown = Duration.ofSeconds(60);

    private Ens ens = new Ens();

    public void setNetwork(Map<String, NetworkEntry> network) {
        this.network = network != null ? network : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {

        private List<String> urls = new ArrayList<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }

    /** Exponential backoff ± jitter between attempts. */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private long baseDelayMs = 500L;

        private long maxDelayMs = 10_000L;

        /** 0..1, e.g. 0.2 = ±20%. */
        private double jitterFactor = 0.2;

        /** Total attempts per call, the first included. */
        private int maxAttempts = 3;
    }

    /** Mainnet ENS reverse lookups; they go through the ETHEREUM endpoints whatever the analyzed network. */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Ens {

        private boolean enabled = true;
    }
}
