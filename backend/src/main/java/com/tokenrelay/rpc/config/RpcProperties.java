package com.tokenrelay.rpc.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Solana RPC endpoints and load balancer tuning. Documented in application.yml under tokenrelay.rpc.
 */
@ConfigurationProperties(prefix = "tokenrelay.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    public static final String PUBLIC_MAINNET_URL = "https://api.mainnet-beta.solana.com";

    /** RPC endpoints; the public mainnet endpoint is used when none is configured. */
    private List<Endpoint> endpoints = new ArrayList<>();

    /** Consecutive errors tolerated before an endpoint is marked unhealthy. */
    private int errorThreshold = 5;

    /** Endpoints tried per call. */
    private int maxAttempts = 3;

    private Duration probeInterval = Duration.ofSeconds(5);

    private Duration probeTimeout = Duration.ofSeconds(3);

    /** Timeout of a relayed RPC call. */
    private Duration requestTimeout = Duration.ofSeconds(10);

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Endpoint {
        private String url;
        private int weight = 10;
    }
}
