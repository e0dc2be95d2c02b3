package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.cache.CoalescingSettings;
import com.tokenrelay.common.TieredCache;
import com.tokenrelay.common.TokenBucketRateLimiter;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RpcRelayServiceTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private List<String> nodeCalls;
    private RpcRelayService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        TaskScheduler scheduler = mock(TaskScheduler.class);
        nodeCalls = new CopyOnWriteArrayList<>();
        SolanaRpcClient rpcClient = (url, method, params) -> {
            nodeCalls.add(url + " " + method);
            return Mono.just(LongNode.valueOf(5_000_000L));
        };
        TieredCache cache = new TieredCache("relay", 100, Duration.ofSeconds(1), 10, clock, scheduler, Duration.ofSeconds(10));
        CoalescingCacheManager cacheManager = new CoalescingCacheManager(cache, Map.of(
                Upstream.QUOTE_API, new TokenBucketRateLimiter("quote-api", 45, 50, clock, scheduler),
                Upstream.RPC_NODE, new TokenBucketRateLimiter("rpc-node", 20, 25, clock, scheduler)),
                CoalescingSettings.defaults(), clock);
        RpcLoadBalancer loadBalancer = new RpcLoadBalancer(List.of(new RpcEndpoint("https://node.test")),
                url -> Mono.just(1L), LoadBalancerSettings.defaults(), clock, scheduler);
        service = new RpcRelayService(cacheManager, loadBalancer, rpcClient, Duration.ofSeconds(2), Duration.ofMillis(400));
    }

    @Test
    void relay_callsNodeOnceAndServesRepeatFromCache() {
        ObjectNode params = mapper.createObjectNode().put("address", WALLET);

        StepVerifier.create(service.relay("getBalance", params))
                .expectNextMatches(node -> node.asLong() == 5_000_000L)
                .verifyComplete();
        StepVerifier.create(service.relay("getBalance", params.deepCopy()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(nodeCalls).containsExactly("https://node.test getBalance");
    }

    @Test
    void relay_getSlotUsesShortTtl() {
        StepVerifier.create(service.relay("getSlot", null)).expectNextCount(1).verifyComplete();
        clock.advanceMillis(500);
        StepVerifier.create(service.relay("getSlot", null)).expectNextCount(1).verifyComplete();

        assertThat(nodeCalls).hasSize(2);
    }

    @Test
    void relay_unknownMethod_rejectedBeforeAnyNetworkCall() {
        assertThatThrownBy(() -> service.relay("requestAirdrop", mapper.createObjectNode()))
                .isInstanceOf(UnsupportedRpcMethodException.class);
        assertThat(nodeCalls).isEmpty();
    }
}
