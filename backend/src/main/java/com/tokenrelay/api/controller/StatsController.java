package com.tokenrelay.api.controller;

import com.tokenrelay.api.dto.StatsResponse;
import com.tokenrelay.broadcast.PriceBroadcastServer;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.rpc.RpcLoadBalancer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final CoalescingCacheManager cacheManager;
    private final RpcLoadBalancer loadBalancer;
    private final PriceBroadcastServer broadcastServer;

    @GetMapping
    public StatsResponse stats() {
        return new StatsResponse(cacheManager.getStats(), loadBalancer.getStats(), broadcastServer.subscriberCount(),
                Instant.now());
    }
}
