package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC client abstraction. Endpoint choice and failover belong to {@link RpcLoadBalancer}.
 */
public interface SolanaRpcClient {

    /**
     * Calls {@code method} on the given endpoint and emits the JSON-RPC {@code result} node.
     * JSON-RPC errors surface as {@link RpcException}; HTTP 429 as
     * {@link com.tokenrelay.common.UpstreamRateLimitedException}; connection failures, after retries, as
     * {@link com.tokenrelay.common.TransientNetworkException}.
     */
    Mono<JsonNode> call(String endpointUrl, String method, Object params);
}
