package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.common.RetryPolicy;
import com.tokenrelay.common.TransientNetworkException;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRateLimitedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solana JSON-RPC 2.0 client using WebClient. Connection failures and timeouts become
 * {@link TransientNetworkException} and are retried against the same endpoint per {@link RetryPolicy};
 * HTTP 429 and JSON-RPC errors are not retried here.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientSolanaRpcClient(WebClient.Builder builder, RetryPolicy retryPolicy) {
        this.webClient = builder.build();
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Mono<JsonNode> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : List.of()
        );
        return Mono.defer(() -> webClient.post()
                        .uri(endpointUrl)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(JsonNode.class))
                .onErrorMap(WebClientRequestException.class, e -> new TransientNetworkException(Upstream.RPC_NODE,
                        method + " request to " + endpointUrl + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new TransientNetworkException(Upstream.RPC_NODE,
                        method + " request to " + endpointUrl + " timed out", e))
                .retryWhen(retryPolicy.toRetry(TransientNetworkException.class::isInstance))
                .flatMap(root -> extractResult(method, root))
                .onErrorMap(WebClientResponseException.class, e -> e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                        ? new UpstreamRateLimitedException(Upstream.RPC_NODE, method + " rate limited by " + endpointUrl, null)
                        : new RpcException(method + " failed: " + e.getMessage(), e));
    }

    static Mono<JsonNode> extractResult(String method, JsonNode root) {
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return Mono.error(new RpcException(method + " error: " + error));
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            return Mono.error(new RpcException(method + " returned no result"));
        }
        return Mono.just(result);
    }
}
