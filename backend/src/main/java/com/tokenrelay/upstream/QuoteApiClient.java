package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.common.RetryPolicy;
import com.tokenrelay.common.TransientNetworkException;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRateLimitedException;
import com.tokenrelay.common.UpstreamRejectedException;
import com.tokenrelay.upstream.config.QuoteApiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client of the quote API. Maps 429 to {@link UpstreamRateLimitedException}, other error statuses to
 * {@link UpstreamRejectedException}, and connection failures or timeouts to {@link TransientNetworkException},
 * which alone is retried per {@link RetryPolicy}.
 */
@Slf4j
public class QuoteApiClient {

    static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final QuoteApiProperties properties;
    private final RetryPolicy retryPolicy;

    public QuoteApiClient(WebClient.Builder builder, QuoteApiProperties properties, RetryPolicy retryPolicy) {
        this.webClient = builder.build();
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        if (!properties.hasApiKey()) {
            log.info("No quote API key configured, using public base URL {}", properties.getPublicBaseUrl());
        }
    }

    public Mono<JsonNode> get(UpstreamEndpoint endpoint, MultiValueMap<String, String> params) {
        URI uri = uri(apiBaseUrl(), endpoint.path(), params);
        return exchange(webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> applyApiKey(headers, endpoint.requiresApiKey())), "GET " + endpoint.identifier());
    }

    public Mono<JsonNode> post(UpstreamEndpoint endpoint, JsonNode body) {
        URI uri = uri(apiBaseUrl(), endpoint.path(), null);
        return exchange(webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> applyApiKey(headers, true))
                .bodyValue(body), "POST " + endpoint.identifier());
    }

    /**
     * GET against the token data API; {@code path} is built by the caller from fixed segments.
     */
    public Mono<JsonNode> getData(String path, MultiValueMap<String, String> params) {
        URI uri = uri(properties.getDataBaseUrl(), path, params);
        return exchange(webClient.get().uri(uri).accept(MediaType.APPLICATION_JSON), "GET " + path);
    }

    private Mono<JsonNode> exchange(WebClient.RequestHeadersSpec<?> request, String description) {
        return Mono.defer(() -> request.retrieve()
                        .onStatus(status -> status.value() == 429, response -> Mono.just(rateLimited(response, description)))
                        .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new UpstreamRejectedException(Upstream.QUOTE_API,
                                        response.statusCode().value(), body)))
                        .bodyToMono(JsonNode.class)
                        .onErrorMap(WebClientRequestException.class, e -> new TransientNetworkException(
                                Upstream.QUOTE_API, description + " failed: " + e.getMessage(), e))
                        .onErrorMap(TimeoutException.class, e -> new TransientNetworkException(
                                Upstream.QUOTE_API, description + " timed out", e)))
                .retryWhen(retryPolicy.toRetry(TransientNetworkException.class::isInstance))
                .doOnError(e -> log.warn("Quote API {} failed: {}", description, e.getMessage()));
    }

    private UpstreamRateLimitedException rateLimited(ClientResponse response, String description) {
        Duration retryAfter = parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        return new UpstreamRateLimitedException(Upstream.QUOTE_API, description + " rate limited", retryAfter);
    }

    /**
     * Retry-After in delta-seconds; HTTP-date values and garbage yield null.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void applyApiKey(HttpHeaders headers, boolean needed) {
        if (needed && properties.hasApiKey()) {
            headers.set(API_KEY_HEADER, properties.getApiKey());
        }
    }

    private String apiBaseUrl() {
        return properties.hasApiKey() ? properties.getBaseUrl() : properties.getPublicBaseUrl();
    }

    private static URI uri(String baseUrl, String path, MultiValueMap<String, String> params) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(path)
                .queryParams(params != null ? params : new LinkedMultiValueMap<>())
                .build()
                .encode()
                .toUri();
    }
}
