package com.tokenrelay.upstream.config;

import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.cache.config.CacheProperties;
import com.tokenrelay.common.RetryPolicy;
import com.tokenrelay.upstream.PriceFeedSource;
import com.tokenrelay.upstream.QuoteApiClient;
import com.tokenrelay.upstream.QuoteProxyService;
import com.tokenrelay.upstream.TokenDataService;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Quote API client and the services built on it (proxy, token data, price feed).
 */
@Configuration
@EnableConfigurationProperties(QuoteApiProperties.class)
public class QuoteApiConfig {

    @Bean
    public QuoteApiClient quoteApiClient(WebClient.Builder webClientBuilder, QuoteApiProperties properties,
                                         RetryPolicy retryPolicy) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(properties.getReadTimeoutSeconds()))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(properties.getReadTimeoutSeconds(), TimeUnit.SECONDS)));
        return new QuoteApiClient(webClientBuilder.clone().clientConnector(new ReactorClientHttpConnector(httpClient)),
                properties, retryPolicy);
    }

    @Bean
    public QuoteProxyService quoteProxyService(QuoteApiClient quoteApiClient, CoalescingCacheManager coalescingCacheManager,
                                               CacheProperties cacheProperties) {
        return new QuoteProxyService(quoteApiClient, coalescingCacheManager, cacheProperties.getTtl().getProxy(),
                cacheProperties.getTtl().getQuote());
    }

    @Bean
    public TokenDataService tokenDataService(QuoteApiClient quoteApiClient, CoalescingCacheManager coalescingCacheManager,
                                             CacheProperties cacheProperties, Clock clock) {
        return new TokenDataService(quoteApiClient, coalescingCacheManager, cacheProperties.getTtl(), clock);
    }

    @Bean
    public PriceFeedSource priceFeedSource(QuoteApiClient quoteApiClient, CoalescingCacheManager coalescingCacheManager,
                                           CacheProperties cacheProperties, Clock clock) {
        return new PriceFeedSource(quoteApiClient, coalescingCacheManager, cacheProperties.getTtl().getPrice(), clock);
    }
}
