package com.tokenrelay.api.controller;

import com.tokenrelay.api.dto.RpcRelayRequest;
import com.tokenrelay.api.dto.RpcRelayResponse;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRateLimitedException;
import com.tokenrelay.rpc.RpcRelayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * POST /api/rpc. Relays whitelisted Solana RPC methods through the cache and the endpoint load balancer.
 */
@RestController
@RequestMapping("/api/rpc")
@RequiredArgsConstructor
public class RpcRelayController {

    private final RpcRelayService rpcRelayService;

    @PostMapping
    public Mono<RpcRelayResponse> relay(@RequestBody @Valid RpcRelayRequest request) {
        return rpcRelayService.relay(request.method(), request.params())
                .switchIfEmpty(Mono.error(() -> new UpstreamRateLimitedException(Upstream.RPC_NODE,
                        "Request ceiling reached for " + request.method(), Duration.ofSeconds(1))))
                .map(RpcRelayResponse::new);
    }
}
