package com.tokenrelay.config;

import com.tokenrelay.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by every module: wall clock and the transient-failure retry policy.
 */
@Configuration
@EnableConfigurationProperties(RetryProperties.class)
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(RetryProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getJitterFactor(), properties.getMaxAttempts());
    }
}
