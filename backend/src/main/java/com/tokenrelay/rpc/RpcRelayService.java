package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.common.RequestFingerprint;
import com.tokenrelay.common.Upstream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Relays whitelisted RPC calls: cached and coalesced by method + params, then dispatched through the
 * load balancer.
 */
@Slf4j
@RequiredArgsConstructor
public class RpcRelayService {

    private final CoalescingCacheManager cacheManager;
    private final RpcLoadBalancer loadBalancer;
    private final SolanaRpcClient rpcClient;
    private final Duration resultTtl;
    private final Duration slotTtl;

    /**
     * @throws UnsupportedRpcMethodException for unknown methods or bad params, before any network call
     */
    public Mono<JsonNode> relay(String method, JsonNode params) {
        RpcMethod rpcMethod = RpcMethod.fromRelayName(method);
        List<Object> nodeParams = rpcMethod.nodeParams(params);
        String key = RequestFingerprint.of(rpcMethod.nodeMethod(), nodeParams);
        Duration ttl = rpcMethod == RpcMethod.GET_SLOT ? slotTtl : resultTtl;
        log.debug("Relaying {} as {}", method, key);
        return cacheManager.get(Upstream.RPC_NODE, key,
                () -> loadBalancer.execute(url -> rpcClient.call(url, rpcMethod.nodeMethod(), nodeParams)), ttl);
    }
}
