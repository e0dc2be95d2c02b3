package com.tokenrelay.broadcast.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Price stream configuration. Documented in application.yml under tokenrelay.broadcast.
 */
@ConfigurationProperties(prefix = "tokenrelay.broadcast")
@NoArgsConstructor
@Getter
@Setter
public class BroadcastProperties {

    private Duration pollInterval = Duration.ofSeconds(5);

    private Duration keepAliveInterval = Duration.ofSeconds(30);

    /** Subscribers that consumed nothing for this long are dropped. */
    private Duration idleTimeout = Duration.ofMinutes(2);

    /** A poll slower than this skips the tick. */
    private Duration pollTimeout = Duration.ofSeconds(4);

    /** How long a polled price stays in the last-known values shown to new subscribers. */
    private Duration lastKnownTtl = Duration.ofMinutes(10);

    private int subscriberBufferSize = 32;

    /** Token mints polled every tick. Default SOL, USDC, USDT. */
    private List<String> trackedIds = new ArrayList<>(List.of(
            "So11111111111111111111111111111111111111112",
            "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v",
            "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB"
    ));
}
