package com.tokenrelay.rpc.config;

import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.cache.config.CacheProperties;
import com.tokenrelay.common.RetryPolicy;
import com.tokenrelay.rpc.LoadBalancerSettings;
import com.tokenrelay.rpc.RpcEndpoint;
import com.tokenrelay.rpc.RpcLoadBalancer;
import com.tokenrelay.rpc.RpcRelayService;
import com.tokenrelay.rpc.SolanaRpcClient;
import com.tokenrelay.rpc.WebClientSolanaRpcClient;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.List;

/**
 * RPC client, endpoint load balancer (probing with getSlot) and relay service.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RpcProperties.class)
public class RpcConfig {

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, RpcProperties properties,
                                           RetryPolicy retryPolicy) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getProbeTimeout().toMillis())
                .responseTimeout(properties.getRequestTimeout());
        return new WebClientSolanaRpcClient(webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient)), retryPolicy);
    }

    @Bean
    public RpcLoadBalancer rpcLoadBalancer(SolanaRpcClient solanaRpcClient, RpcProperties properties,
                                           Clock clock, TaskScheduler taskScheduler) {
        List<RpcEndpoint> endpoints = properties.getEndpoints().stream()
                .filter(e -> StringUtils.hasText(e.getUrl()))
                .map(e -> new RpcEndpoint(e.getUrl().trim(), e.getWeight()))
                .toList();
        if (endpoints.isEmpty()) {
            log.info("No RPC endpoints configured, using {}", RpcProperties.PUBLIC_MAINNET_URL);
            endpoints = List.of(new RpcEndpoint(RpcProperties.PUBLIC_MAINNET_URL));
        }
        LoadBalancerSettings settings = new LoadBalancerSettings(properties.getErrorThreshold(),
                properties.getMaxAttempts(), properties.getProbeInterval(), properties.getProbeTimeout());
        return new RpcLoadBalancer(endpoints, url -> solanaRpcClient.call(url, "getSlot", List.of()),
                settings, clock, taskScheduler);
    }

    @Bean
    public RpcRelayService rpcRelayService(CoalescingCacheManager coalescingCacheManager, RpcLoadBalancer rpcLoadBalancer,
                                           SolanaRpcClient solanaRpcClient, CacheProperties cacheProperties) {
        return new RpcRelayService(coalescingCacheManager, rpcLoadBalancer, solanaRpcClient,
                cacheProperties.getTtl().getRpc(), cacheProperties.getTtl().getSlot());
    }
}
