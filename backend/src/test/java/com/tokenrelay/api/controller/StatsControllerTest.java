package com.tokenrelay.api.controller;

import com.tokenrelay.broadcast.PriceBroadcastServer;
import com.tokenrelay.cache.CacheManagerStats;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.common.CacheStats;
import com.tokenrelay.common.RateLimiterStatus;
import com.tokenrelay.rpc.EndpointHealth;
import com.tokenrelay.rpc.LoadBalancerStats;
import com.tokenrelay.rpc.RpcLoadBalancer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = StatsController.class)
class StatsControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    CoalescingCacheManager cacheManager;

    @MockBean
    RpcLoadBalancer loadBalancer;

    @MockBean
    PriceBroadcastServer broadcastServer;

    @Test
    void stats_reportsCacheLimitersEndpointsAndSubscribers() {
        when(cacheManager.getStats()).thenReturn(new CacheManagerStats(
                new CacheStats("relay", 1, 4, 5, 500), 2, Set.of("quote-api:price:abc"), Map.of("quote-api:price:abc", 3),
                Map.of("quote-api", new RateLimiterStatus("quote-api", 0, 49, 50, 45.0, 0))));
        when(loadBalancer.getStats()).thenReturn(new LoadBalancerStats(
                List.of(new EndpointHealth("https://node.test", true, 120, 0, 1038.0)), 1, 1));
        when(broadcastServer.subscriberCount()).thenReturn(3);

        webTestClient.get().uri("/api/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cacheManager.cache.totalSize").isEqualTo(5)
                .jsonPath("$.cacheManager.pendingFetches").isEqualTo(2)
                .jsonPath("$.cacheManager.rateLimiters['quote-api'].maxBurst").isEqualTo(50)
                .jsonPath("$.loadBalancer.healthyCount").isEqualTo(1)
                .jsonPath("$.loadBalancer.endpoints[0].url").isEqualTo("https://node.test")
                .jsonPath("$.streamSubscribers").isEqualTo(3)
                .jsonPath("$.timestamp").exists();
    }
}
